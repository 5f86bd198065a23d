package org.pragmatica.aether.document;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Front end configuration.
 *
 * @param maxSourceLength       Largest accepted document, in UTF-16 characters
 * @param namingLint            Whether diagnostics include the UPPER_SNAKE_CASE naming lint
 * @param documentationComments Whether symbols pick up the comment block above their declaration
 */
public record FrontendConfig(int maxSourceLength, boolean namingLint, boolean documentationComments) {

    public static final FrontendConfig DEFAULT = new FrontendConfig(1_000_000, true, true);

    public FrontendConfig {
        checkArgument(maxSourceLength > 0, "maxSourceLength must be positive: %s", maxSourceLength);
    }

    public FrontendConfig withMaxSourceLength(int maxSourceLength) {
        return new FrontendConfig(maxSourceLength, namingLint, documentationComments);
    }

    public FrontendConfig withNamingLint(boolean namingLint) {
        return new FrontendConfig(maxSourceLength, namingLint, documentationComments);
    }

    public FrontendConfig withDocumentationComments(boolean documentationComments) {
        return new FrontendConfig(maxSourceLength, namingLint, documentationComments);
    }
}
