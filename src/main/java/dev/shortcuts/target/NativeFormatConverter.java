package dev.shortcuts.target;

/**
 * Converts between the text and binary property list framings. Binary framing is only
 * available where a platform tool can produce it.
 */
public interface NativeFormatConverter {

    Conversion toBinary(byte[] xmlPlist);

    Conversion toXml(byte[] binaryPlist);

    /** A converter for hosts without native tooling. */
    static NativeFormatConverter unavailable() {
        return new NativeFormatConverter() {
            @Override
            public Conversion toBinary(byte[] xmlPlist) {
                return new Conversion.Unavailable("No native property list converter configured");
            }

            @Override
            public Conversion toXml(byte[] binaryPlist) {
                return new Conversion.Unavailable("No native property list converter configured");
            }
        };
    }
}
