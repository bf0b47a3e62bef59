package com.phillippitts.mediametric.config.cache;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Result cache selection.
 * Binds to properties prefixed with "mediametric.cache".
 *
 * @param type backing store
 * @param root directory of the filesystem cache
 */
@ConfigurationProperties(prefix = "mediametric.cache")
@Validated
public record ResultCacheProperties(
        @DefaultValue("FILESYSTEM")
        @NotNull
        Type type,

        @NotBlank(message = "Cache root must not be blank")
        String root
) {

    public enum Type { FILESYSTEM, MEMORY }
}
