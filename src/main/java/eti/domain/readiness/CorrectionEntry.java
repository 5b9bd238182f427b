package eti.domain.readiness;

/**
 * One attempted correction
 * @since 15/10/2026
 */
public record CorrectionEntry(String name, boolean success, String error) {

    public static CorrectionEntry succeeded(String name) {
        return new CorrectionEntry(name, true, null);
    }

    public static CorrectionEntry failed(String name, String error) {
        return new CorrectionEntry(name, false, error);
    }
}
