package com.phillippitts.sttguard.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for data-channel integrity checks.
 *
 * <p>Command-line equivalents of the legacy server flags:
 * <ul>
 *   <li>{@code --verify-data-integrity} = {@code --stt.integrity.verify-enabled=true}</li>
 *   <li>{@code --reject-corrupted-data} = {@code --stt.integrity.reject-enabled=true}</li>
 *   <li>{@code --corruption-threshold N} = {@code --stt.integrity.corruption-threshold=N}</li>
 * </ul>
 *
 * <p>Note: Bean created via {@link com.phillippitts.sttguard.SttGuardApplication#EnableConfigurationProperties}.
 */
@Validated
@ConfigurationProperties(prefix = "stt.integrity")
public class IntegrityProperties {

    private final boolean verifyEnabled;
    private final boolean rejectEnabled;

    /** Failures tolerated per connection before it is rejected (0 = first failure rejects). */
    @Min(0)
    private final int corruptionThreshold;

    /** Log passing verdicts too, not only failures. */
    private final boolean extendedLogging;

    /** Close the connection after an undecodable frame instead of only dropping the frame. */
    private final boolean closeOnDecodeError;

    /** Largest binary message the data channel accepts. */
    @Min(1024)
    private final int maxFrameBytes;

    /** WebSocket path of the data channel. */
    @NotBlank
    private final String dataPath;

    @ConstructorBinding
    public IntegrityProperties(Boolean verifyEnabled,
                               Boolean rejectEnabled,
                               Integer corruptionThreshold,
                               Boolean extendedLogging,
                               Boolean closeOnDecodeError,
                               Integer maxFrameBytes,
                               String dataPath) {
        this.verifyEnabled = Boolean.TRUE.equals(verifyEnabled);
        this.rejectEnabled = Boolean.TRUE.equals(rejectEnabled);
        this.corruptionThreshold = corruptionThreshold == null ? 0 : corruptionThreshold;
        this.extendedLogging = Boolean.TRUE.equals(extendedLogging);
        this.closeOnDecodeError = Boolean.TRUE.equals(closeOnDecodeError);
        this.maxFrameBytes = maxFrameBytes == null ? 1024 * 1024 : maxFrameBytes; // 1 MB
        this.dataPath = (dataPath == null || dataPath.isBlank()) ? "/" : dataPath;
    }

    public boolean isVerifyEnabled() { return verifyEnabled; }
    public boolean isRejectEnabled() { return rejectEnabled; }
    public int getCorruptionThreshold() { return corruptionThreshold; }
    public boolean isExtendedLogging() { return extendedLogging; }
    public boolean isCloseOnDecodeError() { return closeOnDecodeError; }
    public int getMaxFrameBytes() { return maxFrameBytes; }
    public String getDataPath() { return dataPath; }
}
