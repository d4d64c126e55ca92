package ch.so.arp.scenesearch.visual;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.junit.jupiter.api.Test;

class RequestSignerTest {

    private final RequestSigner signer = new RequestSigner("test-secret");

    @Test
    void signsTimestampAndBodyWithHmacSha256() {
        String signature = signer.sign(1700000000L, "{\"text\":\"red car\"}");

        assertThat(signature).startsWith("sha256=").hasSize("sha256=".length() + 64);
        assertThat(signature.substring(7)).matches("[0-9a-f]{64}");
        assertThat(signer.sign(1700000000L, "{\"text\":\"red car\"}")).isEqualTo(signature);
    }

    @Test
    void signatureDependsOnTimestampBodyAndSecret() {
        String signature = signer.sign(1700000000L, "body");

        assertThat(signer.sign(1700000001L, "body")).isNotEqualTo(signature);
        assertThat(signer.sign(1700000000L, "other")).isNotEqualTo(signature);
        assertThat(new RequestSigner("other-secret").sign(1700000000L, "body")).isNotEqualTo(signature);
    }

    @Test
    void signatureIsHexHmacOfTimestampDotBody() throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec("test-secret".getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        String expected = "sha256="
                + HexFormat.of().formatHex(mac.doFinal("42.body".getBytes(StandardCharsets.UTF_8)));

        assertThat(signer.sign(42L, "body")).isEqualTo(expected);
    }

    @Test
    void requiresSecret() {
        assertThatThrownBy(() -> new RequestSigner(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
