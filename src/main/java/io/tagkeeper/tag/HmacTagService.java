package io.tagkeeper.tag;

import io.tagkeeper.config.TagKeeperSettings;
import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.Subject;
import io.tagkeeper.util.Hashing;

import java.time.Clock;
import java.util.Objects;

/**
 * Keyed scheme: {@code tk-hmac-<millis36>~<hex HMAC-SHA256>}.
 *
 * <p>Validation re-derives the MAC from the embedded timestamp, so a tag only
 * passes for the subject and purpose it was issued to.
 */
public final class HmacTagService implements TagService {
    static final String PREFIX = "tk-hmac-";
    private static final char SEP = '~';

    private final String secret;
    private final OwnerMarks owner;
    private final Clock clock;

    public HmacTagService(String secret, String owner, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("HMAC secret must not be blank");
        }
        this.secret = secret;
        this.owner = new OwnerMarks(owner);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public HmacTagService(String secret, String owner) {
        this(secret, owner, Clock.systemUTC());
    }

    @Override
    public String scheme() {
        return TagKeeperSettings.SCHEME_HMAC;
    }

    @Override
    public IntegrityTag generate(Subject subject, String purpose) {
        Objects.requireNonNull(subject, "subject");
        String millis = Long.toString(clock.millis(), 36);
        return IntegrityTag.of(PREFIX + millis + SEP + mac(subject, purpose, millis));
    }

    @Override
    public boolean validate(IntegrityTag tag, Subject subject, String purpose) {
        if (tag == null || subject == null || !tag.value().startsWith(PREFIX)) {
            return false;
        }
        String body = tag.value().substring(PREFIX.length());
        int sep = body.indexOf(SEP);
        if (sep <= 0 || sep == body.length() - 1) {
            return false;
        }
        String millis = body.substring(0, sep);
        if (!OwnerMarks.isBase36(millis, false)) {
            return false;
        }
        return Hashing.constantTimeEquals(mac(subject, purpose, millis), body.substring(sep + 1));
    }

    @Override
    public String watermark(Subject subject) {
        Objects.requireNonNull(subject, "subject");
        return owner.watermark(clock.millis());
    }

    @Override
    public boolean validateWatermark(String watermark, Subject subject) {
        return owner.validWatermark(watermark);
    }

    private String mac(Subject subject, String purpose, String millis) {
        String canonical = subject.id() + "\n" + subject.kind() + "\n" + (purpose == null ? "" : purpose) + "\n" + millis;
        return Hashing.hmacSha256Hex(secret, canonical);
    }
}
