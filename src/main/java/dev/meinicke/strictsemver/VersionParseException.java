package dev.meinicke.strictsemver;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Thrown when a string does not conform to the SemVer 2.0.0 grammar.
 *
 * <p>The rejected text is kept verbatim and can be retrieved with {@link #getInput()}, so callers can
 * report it without re-threading the original argument. The message additionally names the component
 * that failed validation.
 */
public final class VersionParseException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final @NotNull String input;
    private final @NotNull String reason;

    public VersionParseException(@NotNull String input, @NotNull String reason) {
        super("Invalid version '" + input + "': " + reason);
        this.input = Objects.requireNonNull(input, "input");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /**
     * @return the original, untrimmed input that failed to parse
     */
    public @NotNull String getInput() { return input; }

    /**
     * @return the reason the input was rejected, without the input itself
     */
    public @NotNull String getReason() { return reason; }

}
