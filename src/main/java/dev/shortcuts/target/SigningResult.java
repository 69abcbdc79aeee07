package dev.shortcuts.target;

public sealed interface SigningResult {

    record Signed(byte[] data, SigningMode mode) implements SigningResult {}

    record Failed(String reason) implements SigningResult {}
}
