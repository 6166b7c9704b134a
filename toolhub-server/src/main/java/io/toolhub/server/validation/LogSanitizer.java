package io.toolhub.server.validation;

/// Strips control characters from strings to prevent log injection.
///
/// Log injection occurs when user-controlled input containing newline
/// characters ({@code \r}, {@code \n}) is written to log output,
/// allowing attackers to forge log entries. Server ids, names and remote error
/// messages all originate outside the process and pass through here.
///
/// Apply to any user-derived value before passing it to a logger:
/// ```
/// LOG.infov("Connecting to {0}", LogSanitizer.sanitize(serverId));
/// ```
public final class LogSanitizer {

    /// Longest value written to the log; longer input is cut and marked with `...`.
    static final int MAX_LENGTH = 500;

    private LogSanitizer() {}

    /// Removes control characters from the input and caps its length.
    ///
    /// Tabs are kept; every other ISO control character is dropped.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder clean = new StringBuilder(Math.min(value.length(), MAX_LENGTH + 3));
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\t' || !Character.isISOControl(c)) {
                if (clean.length() == MAX_LENGTH) {
                    return clean.append("...").toString();
                }
                clean.append(c);
            }
        }
        return clean.toString();
    }
}
