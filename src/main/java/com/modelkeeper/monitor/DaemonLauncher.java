package com.modelkeeper.monitor;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the monitor in a detached child JVM. The child gets a new session when {@code setsid} is
 * available, reads from /dev/null and discards stdout. Its stderr (console logging, stack traces) is
 * appended to a sibling {@code .err} file so the audit log only holds audit lines.
 */
public class DaemonLauncher {
    private static final Logger log = LoggerFactory.getLogger(DaemonLauncher.class);
    static final List<Path> SETSID_LOCATIONS = List.of(Path.of("/usr/bin/setsid"), Path.of("/bin/setsid"));

    private final String mainClass;
    private final Path logFile;
    private final Duration confirmWindow;
    private final Starter starter;

    public DaemonLauncher(String mainClass, Path logFile, Duration confirmWindow) {
        this(mainClass, logFile, confirmWindow, ProcessBuilder::start);
    }

    DaemonLauncher(String mainClass, Path logFile, Duration confirmWindow, Starter starter) {
        this.mainClass = mainClass;
        this.logFile = logFile;
        this.confirmWindow = confirmWindow;
        this.starter = starter;
    }

    /**
     * Launches the child with {@code arguments} and returns its pid once it survived the confirm window.
     * A child that already finished with status 0 inside the window counts as a completed run.
     *
     * @throws DaemonizationException when the child cannot be started or fails right away
     */
    public long launch(List<String> arguments) throws DaemonizationException {
        List<String> command = command(arguments);
        try {
            if (logFile.getParent() != null) {
                Files.createDirectories(logFile.getParent());
            }
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.appendTo(errorLogFile().toFile()));
            Process process = starter.start(builder);
            if (process.waitFor(confirmWindow.toMillis(), TimeUnit.MILLISECONDS)) {
                int status = process.exitValue();
                if (status == 0) {
                    log.info("daemon.completed pid={} log={}", process.pid(), logFile);
                    return process.pid();
                }
                throw new DaemonizationException("Daemon exited immediately with status " + status
                        + "; see " + errorLogFile());
            }
            log.info("daemon.launched pid={} log={}", process.pid(), logFile);
            return process.pid();
        } catch (IOException e) {
            throw new DaemonizationException("Could not start daemon: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DaemonizationException("Interrupted while starting daemon", e);
        }
    }

    /**
     * {@code monitor.log} becomes {@code monitor.err}; a name without {@code .log} gets {@code .err} appended.
     */
    public Path errorLogFile() {
        String name = logFile.getFileName().toString();
        String base = name.endsWith(".log") ? name.substring(0, name.length() - ".log".length()) : name;
        return logFile.resolveSibling(base + ".err");
    }

    List<String> command(List<String> arguments) {
        List<String> command = new ArrayList<>();
        SETSID_LOCATIONS.stream()
                .filter(Files::isExecutable)
                .findFirst()
                .ifPresent(setsid -> command.add(setsid.toString()));
        command.add(javaExecutable());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(mainClass);
        command.addAll(arguments);
        return command;
    }

    private static String javaExecutable() {
        return Path.of(System.getProperty("java.home"), "bin", "java").toString();
    }

    @FunctionalInterface
    interface Starter {
        Process start(ProcessBuilder builder) throws IOException;
    }
}
