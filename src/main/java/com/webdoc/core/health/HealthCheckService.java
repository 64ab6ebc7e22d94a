package com.webdoc.core.health;

import com.webdoc.config.WebDocProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final WebDocProperties properties;

    public HealthCheckService(WebDocProperties properties) {
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkTool("idea-tool", properties.getTools().getIdea()));
        results.add(checkTool("doc-tool", properties.getTools().getDoc()));
        results.add(checkSessionsDir());
        return results;
    }

    HealthStatus checkTool(String component, WebDocProperties.Tool tool) {
        List<String> command = tool.getCommand();
        if (command == null || command.isEmpty()) {
            return HealthStatus.down(component, "No command configured", Map.of());
        }
        Path workingDir = Path.of(tool.getWorkingDir());
        Map<String, String> metadata = Map.of(
                "command", String.join(" ", command),
                "workingDir", workingDir.toAbsolutePath().normalize().toString());
        if (!Files.isDirectory(workingDir)) {
            return HealthStatus.down(component, "Working directory not found: " + workingDir, metadata);
        }
        if (!isExecutable(command.get(0), workingDir)) {
            return HealthStatus.down(component, "Executable not found: " + command.get(0), metadata);
        }
        for (String arg : command.subList(1, command.size())) {
            if (looksLikeScript(arg) && !Files.isRegularFile(workingDir.resolve(arg))) {
                return HealthStatus.scriptMissing(component, arg, metadata);
            }
        }
        return HealthStatus.up(component, "Tool available", metadata);
    }

    private HealthStatus checkSessionsDir() {
        Path dir = Path.of(properties.getSessionsDir());
        try {
            Files.createDirectories(dir);
            if (Files.isWritable(dir)) {
                return HealthStatus.up("sessions-dir", "Sessions directory writable", Map.of("path", dir.toAbsolutePath().toString()));
            }
            return HealthStatus.down("sessions-dir", "Sessions directory not writable", Map.of("path", dir.toAbsolutePath().toString()));
        } catch (IOException e) {
            log.warn("Sessions directory check failed: {}", e.getMessage());
            return HealthStatus.down("sessions-dir", "Cannot create sessions directory: " + e.getMessage(), Map.of());
        }
    }

    private static boolean isExecutable(String executable, Path workingDir) {
        if (executable.contains("/") || executable.contains(File.separator)) {
            Path path = workingDir.resolve(executable);
            return Files.isExecutable(path);
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return false;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }

    private static boolean looksLikeScript(String arg) {
        return !arg.startsWith("-") && (arg.endsWith(".py") || arg.endsWith(".sh"));
    }
}
