package com.example.consult.session.security;

import com.example.consult.shared.config.AppProperties;
import com.example.consult.shared.util.Constants;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.OptionalLong;

/**
 * Derives the room id of an appointment: {@code apt-<appointmentId>-<signature>} where the signature
 * is a truncated HMAC-SHA256 of the appointment id. Room ids are stable per appointment, decodable,
 * and cannot be forged for another appointment without the secret.
 */
@Component
public class RoomIdCodec {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;
    private final int signatureLength;

    public RoomIdCodec(AppProperties appProperties) {
        this.key = new SecretKeySpec(appProperties.getRoom().getSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.signatureLength = appProperties.getRoom().getSignatureLength();
    }

    public String encode(long appointmentId) {
        return Constants.ROOM_ID_PREFIX + appointmentId + "-" + sign(appointmentId);
    }

    /**
     * @return the appointment id behind {@code roomId}, or empty if the id is malformed, is not the
     * canonical {@link #encode} form, or its signature does not verify
     */
    public OptionalLong decode(String roomId) {
        if (roomId == null || !roomId.startsWith(Constants.ROOM_ID_PREFIX)) {
            return OptionalLong.empty();
        }
        String body = roomId.substring(Constants.ROOM_ID_PREFIX.length());
        int separator = body.lastIndexOf('-');
        if (separator <= 0 || separator == body.length() - 1) {
            return OptionalLong.empty();
        }
        String idPart = body.substring(0, separator);
        long appointmentId;
        try {
            appointmentId = Long.parseLong(idPart);
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
        // One spelling per appointment: no sign, no leading zeros
        if (appointmentId <= 0 || !Long.toString(appointmentId).equals(idPart)) {
            return OptionalLong.empty();
        }
        byte[] expected = sign(appointmentId).getBytes(StandardCharsets.US_ASCII);
        byte[] presented = body.substring(separator + 1).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, presented) ? OptionalLong.of(appointmentId) : OptionalLong.empty();
    }

    private String sign(long appointmentId) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal(Long.toString(appointmentId).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, signatureLength);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }
}
