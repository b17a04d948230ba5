package com.labelsel;

import com.labelsel.json.LabelsJsonReader;
import com.labelsel.json.SelectorJsonReader;
import com.labelsel.selector.Selector;
import com.labelsel.selector.SelectorNode;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "labelsel", mixinStandardHelpOptions = true, version = "1.0",
         description = "Evaluate a label selector tree against a set of labels",
         exitCodeOnInvalidInput = LabelSel.EXIT_ERROR, exitCodeOnExecutionException = LabelSel.EXIT_ERROR)
public class LabelSel implements Callable<Integer> {
    static final int EXIT_MATCH = 0;
    static final int EXIT_NO_MATCH = 1;
    static final int EXIT_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(LabelSel.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Selector tree JSON file (default: stdin)")
    private File selectorFile;

    @Option(names = {"-l", "--label"}, description = "Label as key=value, may be repeated")
    private Map<String, String> labels = new LinkedHashMap<>();

    @Option(names = {"-f", "--labels-file"}, description = "JSON object of labels")
    private File labelsFile;

    @Option(names = {"-s", "--canonical"}, description = "Print the canonical selector string")
    private boolean printCanonical = false;

    @Option(names = {"-i", "--id"}, description = "Print the selector's unique ID")
    private boolean printId = false;

    @Option(names = {"-q", "--quiet"}, description = "Do not print the match result, only set the exit code")
    private boolean quiet = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LabelSel()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Selector selector = Selector.of(readSelector());
            MutableMap<String, String> labelSet = readLabels();

            if (printCanonical) {
                out.println(selector);
            }
            if (printId) {
                out.println(selector.uniqueId());
            }

            boolean matches = selector.evaluate(labelSet);
            if (!quiet) {
                out.println(matches);
            }
            out.flush();
            return matches ? EXIT_MATCH : EXIT_NO_MATCH;
        } catch (IOException e) {
            LOG.debug("Failed to read input", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private SelectorNode readSelector() throws IOException {
        SelectorJsonReader reader = new SelectorJsonReader();
        if (selectorFile == null || "-".equals(selectorFile.getPath())) {
            return reader.read(System.in);
        }
        try (InputStream input = new FileInputStream(selectorFile)) {
            return reader.read(input);
        }
    }

    private MutableMap<String, String> readLabels() throws IOException {
        MutableMap<String, String> result = Maps.mutable.empty();
        if (labelsFile != null) {
            try (InputStream input = new FileInputStream(labelsFile)) {
                result.putAll(new LabelsJsonReader().read(input));
            }
        }
        result.putAll(labels);
        return result;
    }
}
