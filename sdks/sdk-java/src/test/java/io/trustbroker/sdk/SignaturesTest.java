package io.trustbroker.sdk;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignaturesTest {
  private static Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("providerId", "prov-1");
    payload.put("dataOwnerId", "owner-1");
    payload.put("schemaId", "schema-1");
    payload.put("expiresIn", 3600);
    payload.put("fields", Arrays.asList("name", "dob"));
    return payload;
  }

  @Test
  void signAndVerify() {
    List<Object> payloads = Arrays.asList(payload(), Map.of(), Arrays.asList(1, "two", null), "raw text", 42);
    for (Object payload : payloads) {
      String signature = Signatures.sign(TestKeys.PAIR.getPrivate(), payload);
      assertTrue(Signatures.verify(TestKeys.PAIR.getPublic(), payload, signature), "payload " + payload);
    }
  }

  @Test
  void repeatedSignaturesBothVerify() {
    String first = Signatures.sign(TestKeys.PAIR.getPrivate(), payload());
    String second = Signatures.sign(TestKeys.PAIR.getPrivate(), payload());
    assertTrue(Signatures.verify(TestKeys.PAIR.getPublic(), payload(), first));
    assertTrue(Signatures.verify(TestKeys.PAIR.getPublic(), payload(), second));
  }

  @Test
  void verificationIgnoresKeyInsertionOrder() {
    Map<String, Object> reordered = new LinkedHashMap<>();
    reordered.put("fields", Arrays.asList("name", "dob"));
    reordered.put("expiresIn", 3600);
    reordered.put("schemaId", "schema-1");
    reordered.put("dataOwnerId", "owner-1");
    reordered.put("providerId", "prov-1");

    String signature = Signatures.sign(TestKeys.PAIR.getPrivate(), payload());
    assertTrue(Signatures.verify(TestKeys.PAIR.getPublic(), reordered, signature));
  }

  @Test
  void signatureOverCanonicalTextMatchesStructuredPayload() {
    String text = Canonicalizer.canonicalString(payload());
    String signature = Signatures.sign(TestKeys.PAIR.getPrivate(), text);
    assertTrue(Signatures.verify(TestKeys.PAIR.getPublic(), payload(), signature));
    assertTrue(Signatures.verify(TestKeys.PAIR.getPublic(), text.getBytes(StandardCharsets.UTF_8), signature));
  }

  @Test
  void rejectsTamperedPayload() {
    String signature = Signatures.sign(TestKeys.PAIR.getPrivate(), payload());

    Map<String, Object> changedValue = payload();
    changedValue.put("schemaId", "schema-2");
    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), changedValue, signature));

    Map<String, Object> reorderedArray = payload();
    reorderedArray.put("fields", Arrays.asList("dob", "name"));
    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), reorderedArray, signature));

    Map<String, Object> extraKey = payload();
    extraKey.put("extra", true);
    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), extraKey, signature));
  }

  @Test
  void loneSurrogateCannotStandInForQuestionMark() {
    String signature = Signatures.sign(TestKeys.PAIR.getPrivate(), Map.of("amount", "?"));

    assertTrue(Signatures.verify(TestKeys.PAIR.getPublic(), Map.of("amount", "?"), signature));
    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), Map.of("amount", "\uDC00"), signature));
    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), Map.of("amount", "\uD800"), signature));
  }

  @Test
  void rejectsWrongPublicKey() {
    String signature = Signatures.sign(TestKeys.PAIR.getPrivate(), payload());
    assertFalse(Signatures.verify(TestKeys.OTHER.getPublic(), payload(), signature));
  }

  @Test
  void malformedSignaturesAreFalseNotErrors() {
    String signature = Signatures.sign(TestKeys.PAIR.getPrivate(), payload());
    byte[] raw = Base64.getDecoder().decode(signature);

    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), payload(), "not base64 !!"));
    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), payload(), ""));
    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), payload(), null));
    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), payload(),
        Base64.getEncoder().encodeToString(Arrays.copyOf(raw, raw.length / 2))));

    raw[10] ^= 0x01;
    assertFalse(Signatures.verify(TestKeys.PAIR.getPublic(), payload(), Base64.getEncoder().encodeToString(raw)));
  }

  @Test
  void unusableVerificationKeyIsAnError() {
    String signature = Signatures.sign(TestKeys.PAIR.getPrivate(), payload());
    KeyPair ec = TestKeys.generate("EC", 256);

    assertThrows(VerificationException.class, () -> Signatures.verify(ec.getPublic(), payload(), signature));
    assertThrows(VerificationException.class, () -> Signatures.verify("-----BEGIN PUBLIC KEY-----\nAAAA\n-----END PUBLIC KEY-----", payload(), signature));
    assertThrows(VerificationException.class, () -> Signatures.verify("%%%", payload(), signature));
    assertThrows(VerificationException.class, () -> Signatures.verify((java.security.PublicKey) null, payload(), signature));
  }

  @Test
  void unusableSigningKeyIsAnError() {
    KeyPair ec = TestKeys.generate("EC", 256);
    SigningException error = assertThrows(SigningException.class, () -> Signatures.sign(ec.getPrivate(), payload()));
    assertEquals(SigningException.STATUS, error.getStatus());
    assertThrows(SigningException.class, () -> Signatures.sign(null, payload()));
  }

  @Test
  void cyclicPayloadFailsToSign() {
    Map<String, Object> cyclic = new LinkedHashMap<>();
    cyclic.put("self", cyclic);
    assertThrows(SigningException.class, () -> Signatures.sign(TestKeys.PAIR.getPrivate(), cyclic));
  }

  @Test
  void verifiesWithPemEncodings() {
    String signature = Signatures.sign(TestKeys.PAIR.getPrivate(), payload());
    assertTrue(Signatures.verify(TestKeys.pem(TestKeys.PAIR.getPublic()), payload(), signature));
    assertTrue(Signatures.verify(TestKeys.pkcs1Pem(TestKeys.PAIR.getPublic()), payload(), signature));

    String bareDer = Base64.getEncoder().encodeToString(TestKeys.PAIR.getPublic().getEncoded());
    assertTrue(Signatures.verify(bareDer, payload(), signature));
  }

  @Test
  void signsWithPkcs1PrivateKey() {
    String signature = Signatures.sign(Pem.privateKey(TestKeys.pkcs1Pem(TestKeys.PAIR.getPrivate())), payload());
    assertTrue(Signatures.verify(TestKeys.PAIR.getPublic(), payload(), signature));
  }
}
