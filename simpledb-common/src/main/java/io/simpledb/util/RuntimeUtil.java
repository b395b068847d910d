package io.simpledb.util;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;

public class RuntimeUtil {

    /**
     * Parses {@code args} into the annotated fields of {@code options}. Prints the usage and exits the
     * process on bad arguments.
     */
    public static CmdLineParser parseArgs(String[] args, Object options) {
        CmdLineParser parser = new CmdLineParser(options);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            System.err.println();
            System.exit(1);
        }
        return parser;
    }

    public static void printUsage(CmdLineParser parser, String command) {
        System.out.println("Usage: " + command + " [options]");
        parser.printUsage(System.out);
    }
}
