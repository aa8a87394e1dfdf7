package io.tagkeeper.tag;

import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.Subject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

final class HmacTagServiceTest {
    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @Test
    void tagValidatesOnlyForIssuedSubjectAndPurpose() {
        HmacTagService service = new HmacTagService("s3cret", "tagkeeper", FIXED);
        Subject subject = Subject.of("component", "auth-service");

        IntegrityTag tag = service.generate(subject, "ledger-record");

        Assertions.assertTrue(tag.value().startsWith("tk-hmac-"));
        Assertions.assertTrue(service.validate(tag, subject, "ledger-record"));
        Assertions.assertFalse(service.validate(tag, Subject.of("component", "other"), "ledger-record"));
        Assertions.assertFalse(service.validate(tag, Subject.of("cache", "auth-service"), "ledger-record"));
        Assertions.assertFalse(service.validate(tag, subject, "other-purpose"));
    }

    @Test
    void differentSecretRejectsTag() {
        Subject subject = Subject.of("component", "auth-service");
        IntegrityTag tag = new HmacTagService("s3cret", "tagkeeper", FIXED).generate(subject, "p");
        Assertions.assertFalse(new HmacTagService("other", "tagkeeper", FIXED).validate(tag, subject, "p"));
    }

    @Test
    void forgedOrTamperedTagsAreRejected() {
        HmacTagService service = new HmacTagService("s3cret", "tagkeeper", FIXED);
        Subject subject = Subject.of("component", "auth-service");
        String value = service.generate(subject, "p").value();
        char last = value.charAt(value.length() - 1);
        String flipped = value.substring(0, value.length() - 1) + (last == '0' ? '1' : '0');

        Assertions.assertFalse(service.validate(IntegrityTag.of(flipped), subject, "p"));
        Assertions.assertFalse(service.validate(IntegrityTag.of("tk-hmac-kx1~deadbeef"), subject, "p"));
        Assertions.assertFalse(service.validate(IntegrityTag.of("tk-hmac-~abc"), subject, "p"));
        Assertions.assertFalse(service.validate(IntegrityTag.of("tk-hmac-kx1~"), subject, "p"));
        Assertions.assertFalse(service.validate(IntegrityTag.of("tk-sig-1~tagke~kx1"), subject, "p"));
        Assertions.assertFalse(service.validate(null, subject, "p"));
    }

    @Test
    void blankSecretIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new HmacTagService(" ", "tagkeeper", FIXED));
    }

    @Test
    void watermarkMatchesRollingScheme() {
        HmacTagService hmac = new HmacTagService("s3cret", "tagkeeper", FIXED);
        RollingHashTagService rolling = new RollingHashTagService("tagkeeper", FIXED);
        Subject subject = Subject.of("cache", "a");
        Assertions.assertEquals(rolling.watermark(subject), hmac.watermark(subject));
        Assertions.assertTrue(hmac.validateWatermark(rolling.watermark(subject), subject));
    }
}
