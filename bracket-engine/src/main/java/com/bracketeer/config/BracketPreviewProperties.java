package com.bracketeer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Command-line preview settings. The preview runner stays idle unless {@code input} is set.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bracketeer.preview")
public class BracketPreviewProperties {

    /**
     * Path to a JSON preview request.
     */
    private String input;

    /**
     * Optional output file; matches are printed to standard output when unset.
     */
    private String output;

    private boolean pretty = true;
}
