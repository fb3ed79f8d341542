package com.phillippitts.adaptiveencoder.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Root for per-run work directories. Binds to "encoder.work".
 *
 * @param tempDir directory under which each run creates its own {@code run-<id>} folder
 */
@ConfigurationProperties(prefix = "encoder.work")
@Validated
public record WorkspaceProperties(
        @NotBlank(message = "Work temp dir must not be blank")
        String tempDir
) {
    @ConstructorBinding
    public WorkspaceProperties {
    }

    public WorkspaceProperties() {
        this(System.getProperty("java.io.tmpdir") + "/adaptive-encoder");
    }

    public Path tempRoot() {
        return Path.of(tempDir);
    }
}
