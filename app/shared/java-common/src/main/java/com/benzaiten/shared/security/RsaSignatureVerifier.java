package com.benzaiten.shared.security;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * 요청 메시지 서명 검증기
 *
 * <p>SHA-512 digest에 대한 RSA PKCS#1 v1.5 서명을 검증합니다.
 * 서명은 base64 문자열, 공개키는 PEM 또는 DER 바이트로 전달됩니다.</p>
 *
 * <p>검증 실패 원인(잘못된 서명, 손상된 공개키, 잘못된 base64)은 구분하지 않고 모두 false를 반환합니다.</p>
 */
@Slf4j
public class RsaSignatureVerifier {

    private static final String SIGNATURE_ALGORITHM = "SHA512withRSA";
    private static final String PEM_PREFIX = "-----BEGIN";
    private static final String PKCS1_PEM_HEADER = "-----BEGIN RSA PUBLIC KEY-----";

    // AlgorithmIdentifier { rsaEncryption, NULL }
    private static final byte[] RSA_ALGORITHM_IDENTIFIER = {
            0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86,
            (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    /**
     * @param message         서명된 메시지 원본 바이트
     * @param signatureBase64 base64 인코딩된 서명
     * @param publicKey       RSA 공개키 (PEM 또는 DER)
     * @return 서명이 유효하면 true
     */
    public boolean verify(byte[] message, String signatureBase64, byte[] publicKey) {
        if (message == null || signatureBase64 == null || publicKey == null) {
            return false;
        }
        try {
            byte[] signature = Base64.getDecoder().decode(signatureBase64.getBytes(StandardCharsets.UTF_8));

            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(loadPublicKey(publicKey));
            verifier.update(message);
            return verifier.verify(signature);

        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("Signature check failed: {}", e.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * PEM(SubjectPublicKeyInfo / PKCS#1) 또는 DER(SubjectPublicKeyInfo) 공개키를 로드합니다.
     */
    PublicKey loadPublicKey(byte[] encoded) throws GeneralSecurityException {
        byte[] der = encoded;
        String text = new String(encoded, StandardCharsets.US_ASCII);
        if (text.startsWith(PEM_PREFIX)) {
            der = decodePem(text);
            if (text.startsWith(PKCS1_PEM_HEADER)) {
                der = wrapPkcs1(der);
            }
        }
        return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
    }

    private static byte[] decodePem(String pem) {
        StringBuilder base64 = new StringBuilder();
        for (String line : pem.split("\\r?\\n")) {
            if (!line.startsWith("-----")) {
                base64.append(line.trim());
            }
        }
        return Base64.getDecoder().decode(base64.toString());
    }

    /**
     * PKCS#1 RSAPublicKey를 SubjectPublicKeyInfo로 감쌉니다.
     */
    private static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream bitString = new ByteArrayOutputStream();
        bitString.write(0x03);
        writeLength(bitString, pkcs1.length + 1);
        bitString.write(0x00);
        bitString.writeBytes(pkcs1);

        ByteArrayOutputStream spki = new ByteArrayOutputStream();
        spki.write(0x30);
        writeLength(spki, RSA_ALGORITHM_IDENTIFIER.length + bitString.size());
        spki.writeBytes(RSA_ALGORITHM_IDENTIFIER);
        spki.writeBytes(bitString.toByteArray());
        return spki.toByteArray();
    }

    private static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 0x80) {
            out.write(length);
        } else if (length <= 0xff) {
            out.write(0x81);
            out.write(length);
        } else if (length <= 0xffff) {
            out.write(0x82);
            out.write(length >> 8);
            out.write(length & 0xff);
        } else {
            out.write(0x83);
            out.write(length >> 16);
            out.write((length >> 8) & 0xff);
            out.write(length & 0xff);
        }
    }
}
