package org.mimir.install.ecosystem;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.SourceTier;
import org.mimir.error.TierFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * {@link PackageManager} driven by command templates. Placeholders: {@code {dir}},
 * {@code {name}}, {@code {namespace}}, {@code {version}}.
 */
public class CommandLinePackageManager implements PackageManager {
    private static final Logger logger = LoggerFactory.getLogger(CommandLinePackageManager.class);
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    private final String name;
    private final Set<String> ecosystems;
    private final List<String> probeCommand;
    private final List<String> installTemplate;
    private final String binaryTemplate;
    private final Duration timeout;
    private final ProcessRunner runner;

    private volatile Boolean available;

    public CommandLinePackageManager(String name, Set<String> ecosystems, List<String> probeCommand,
                                     List<String> installTemplate, String binaryTemplate,
                                     Duration timeout, ProcessRunner runner) {
        this.name = name;
        this.ecosystems = Set.copyOf(ecosystems);
        this.probeCommand = List.copyOf(probeCommand);
        this.installTemplate = List.copyOf(installTemplate);
        this.binaryTemplate = binaryTemplate;
        this.timeout = timeout;
        this.runner = runner;
    }

    public static CommandLinePackageManager npm(Duration timeout, ProcessRunner runner) {
        return new CommandLinePackageManager("npm", Set.of("npm"),
                List.of("npm", "--version"),
                List.of("npm", "install", "--prefix", "{dir}", "--no-save", "--no-audit", "--no-fund", "{name}@{version}"),
                "node_modules/.bin/{name}",
                timeout, runner);
    }

    public static CommandLinePackageManager cargo(Duration timeout, ProcessRunner runner) {
        return new CommandLinePackageManager("cargo", Set.of("cargo", "crates"),
                List.of("cargo", "--version"),
                List.of("cargo", "install", "--root", "{dir}", "--version", "{version}", "--locked", "{name}"),
                "bin/{name}",
                timeout, runner);
    }

    /** Known managers by name, for configuration. */
    public static CommandLinePackageManager byName(String name, Duration timeout, ProcessRunner runner) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "npm" -> npm(timeout, runner);
            case "cargo" -> cargo(timeout, runner);
            default -> throw new IllegalArgumentException("Unknown package manager: " + name);
        };
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean handles(String ecosystem) {
        return ecosystem != null && ecosystems.contains(ecosystem.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean isAvailable() {
        Boolean a = available;
        if (a == null) {
            a = probe();
            available = a;
        }
        return a;
    }

    private boolean probe() {
        try {
            ProcessRunner.Result r = runner.run(probeCommand, null, PROBE_TIMEOUT);
            if (r.ok()) {
                logger.info("Detected {} {}", name, r.output());
                return true;
            }
            logger.info("{} probe exited with {}; native tier disabled for it", name, r.exitCode());
            return false;
        } catch (IOException | TimeoutException e) {
            logger.info("{} not available on this host: {}", name, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public Path install(ArtifactReference reference, Path targetDir) {
        Map<String, String> vars = Map.of(
                "{dir}", targetDir.toAbsolutePath().toString(),
                "{name}", reference.name(),
                "{namespace}", reference.namespace(),
                "{version}", reference.version());
        List<String> command = new ArrayList<>(installTemplate.size());
        for (String part : installTemplate) {
            command.add(expand(part, vars));
        }

        ProcessRunner.Result result;
        try {
            logger.info("Installing {} with {}", reference, name);
            result = runner.run(command, targetDir, timeout);
        } catch (TimeoutException e) {
            throw new TierFailedException(SourceTier.NATIVE, reference, name + " install timed out after " + timeout, e);
        } catch (IOException e) {
            throw new TierFailedException(SourceTier.NATIVE, reference, name + " could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TierFailedException(SourceTier.NATIVE, reference, name + " install interrupted", e);
        }
        if (!result.ok()) {
            throw new TierFailedException(SourceTier.NATIVE, reference,
                    name + " install exited with " + result.exitCode() + ": " + result.output());
        }

        Path binary = targetDir.resolve(expand(binaryTemplate, vars));
        if (!Files.isRegularFile(binary)) {
            throw new TierFailedException(SourceTier.NATIVE, reference,
                    name + " reported success but " + binary + " does not exist");
        }
        return binary;
    }

    private static String expand(String template, Map<String, String> vars) {
        String s = template;
        for (Map.Entry<String, String> e : vars.entrySet()) {
            s = s.replace(e.getKey(), e.getValue());
        }
        return s;
    }
}
