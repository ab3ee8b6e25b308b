package uk.gegc.unfurl.features.decoder.domain.model;

/**
 * How a wrapped link carries its destination.
 */
public enum EncodingVariant {
    LEGACY_EMBEDDED,   // destination packed into a base64 binary blob in the path
    REDIRECT_BASED     // destination only visible by following live redirects
}
