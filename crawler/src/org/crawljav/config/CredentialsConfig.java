package org.crawljav.config;

import java.util.List;

/**
 * @param file        cookie JSON file
 * @param required    cookies without which no stage is started
 * @param recommended cookies whose absence is only logged
 */
public record CredentialsConfig(
        String file,
        List<String> required,
        List<String> recommended
) {
    public CredentialsConfig withFile(String file) {
        return new CredentialsConfig(file, required, recommended);
    }
}
