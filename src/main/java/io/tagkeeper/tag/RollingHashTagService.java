package io.tagkeeper.tag;

import io.tagkeeper.config.TagKeeperConfig;
import io.tagkeeper.config.TagKeeperSettings;
import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.Subject;

import java.time.Clock;
import java.util.Objects;

/**
 * Default scheme: a 32-bit rolling hash over subject, purpose, owner and time.
 *
 * <p>Tags look like {@code tk-sig-<hash36>~<owner5>~<millis36>}. This is a
 * tamper-evidence marker only; a forged tag with the right shape passes
 * {@link #validate}. Use {@link HmacTagService} where forgery matters.
 */
public final class RollingHashTagService implements TagService {
    static final String PREFIX = "tk-sig-";
    private static final char SEP = '~';

    private final OwnerMarks owner;
    private final Clock clock;

    public RollingHashTagService(String owner, Clock clock) {
        this.owner = new OwnerMarks(owner);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RollingHashTagService(String owner) {
        this(owner, Clock.systemUTC());
    }

    @Override
    public String scheme() {
        return TagKeeperSettings.SCHEME_ROLLING;
    }

    @Override
    public IntegrityTag generate(Subject subject, String purpose) {
        Objects.requireNonNull(subject, "subject");
        long now = clock.millis();
        String base = subject.id() + "-" + subject.kind() + "-" + (purpose == null ? "" : purpose)
                + "-" + owner.slug() + "-" + TagKeeperConfig.VERSION + "-" + now;
        int hash = 0;
        for (int i = 0; i < base.length(); i++) {
            hash = 31 * hash + base.charAt(i);
        }
        return IntegrityTag.of(PREFIX + Integer.toString(hash, 36)
                + SEP + owner.fragment()
                + SEP + Long.toString(now, 36));
    }

    @Override
    public boolean validate(IntegrityTag tag, Subject subject, String purpose) {
        if (tag == null || tag.isBlank() || !tag.value().startsWith(PREFIX)) {
            return false;
        }
        String body = tag.value().substring(PREFIX.length());
        String[] parts = body.split(String.valueOf(SEP), -1);
        if (parts.length != 3) {
            return false;
        }
        return OwnerMarks.isBase36(parts[0], true)
                && owner.fragment().equals(parts[1])
                && OwnerMarks.isBase36(parts[2], false);
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
}
