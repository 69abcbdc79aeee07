package dev.shortcuts.target;

/**
 * Signs an encoded shortcut so the platform will import it.
 */
@FunctionalInterface
public interface ShortcutSigner {

    SigningResult sign(byte[] shortcut, SigningMode mode);
}
