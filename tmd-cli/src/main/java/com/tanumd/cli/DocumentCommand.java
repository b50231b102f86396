package com.tanumd.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Base class for commands that work on documents.
 *
 * <p>Subclasses implement {@link #execute()}. Any exception is logged and reported on the
 * error stream, and the command exits with code 1.
 */
public abstract class DocumentCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DocumentCommand.class);

    @Spec
    protected CommandSpec spec;

    @Mixin
    protected ConfigOption config;

    @Override
    public Integer call() {
        try {
            execute();
            return 0;
        } catch (Exception e) {
            log.error("{} failed: {}", spec.name(), e.getMessage());
            log.debug("Stack trace", e);
            err().println("✗ " + spec.name() + " failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Runs the command.
     *
     * @throws Exception on any failure
     */
    protected abstract void execute() throws Exception;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
