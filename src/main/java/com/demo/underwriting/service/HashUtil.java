package com.demo.underwriting.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public class HashUtil {

    /** Short, stable reference to an applicant for log lines; never the name itself. */
    public static String applicantRef(String fullName, String email) {
        String seed = (fullName == null ? "" : fullName.trim().toLowerCase(Locale.ROOT))
                + "|" + (email == null ? "" : email.trim().toLowerCase(Locale.ROOT));
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] b = md.digest(seed.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder("app-");
            for (int i = 0; i < 6; i++) sb.append(String.format("%02x", b[i]));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
