package com.challenges.jtree;

import com.challenges.jtree.json.JsonParser;
import com.challenges.jtree.json.ParseResult;
import com.challenges.jtree.output.JsonPrinter;
import com.challenges.jtree.text.JsonMinifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "jtree", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse, reformat and minify JSON documents")
public class JTree implements Callable<Integer> {
    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    private static final int EXCERPT_RADIUS = 20;

    @Parameters(index = "0", arity = "0..1", description = "Input JSON file (default: stdin)")
    private File inputFile;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-m", "--minify"}, description = "Strip whitespace and comments from the text without parsing it")
    private boolean minifyOnly = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
    private boolean sortKeys = false;

    @Option(names = "--strict", description = "Reject anything but whitespace after the top-level value")
    private boolean strict = false;

    @Option(names = "--allow-comments", description = "Strip comments before parsing")
    private boolean allowComments = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JTree()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String text;
        try {
            text = readInput();
        } catch (IOException e) {
            LOGGER.debug("Unable to read input", e);
            err.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        if (minifyOnly) {
            out.println(JsonMinifier.minify(text));
            return 0;
        }

        if (allowComments) {
            text = JsonMinifier.minify(text);
        }

        ParseResult result = new JsonParser().parse(text, strict);
        if (result instanceof ParseResult.Failure failure) {
            err.println("Error: " + failure.message() + " at offset " + failure.position());
            err.println("  " + excerpt(text, failure.position()));
            return EXIT_PARSE_ERROR;
        }

        JsonPrinter printer = new JsonPrinter(!compactOutput, sortKeys);
        out.println(printer.print(result.orElseThrow()));
        return 0;
    }

    private String readInput() throws IOException {
        if (inputFile != null) {
            return Files.readString(inputFile.toPath(), StandardCharsets.UTF_8);
        }
        InputStream input = System.in;
        return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    }

    /**
     * The text around {@code position} on one line, with the offending char bracketed.
     */
    static String excerpt(String text, int position) {
        int start = Math.max(0, position - EXCERPT_RADIUS);
        int end = Math.min(text.length(), position + EXCERPT_RADIUS);
        StringBuilder sb = new StringBuilder();
        sb.append(text, start, Math.min(position, end));
        if (position < text.length()) {
            sb.append(">>").append(text.charAt(position)).append("<<");
            sb.append(text, position + 1, end);
        } else {
            sb.append(">><<");
        }
        return sb.toString().replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(JTree.class);
}
