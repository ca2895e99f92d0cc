package com.contactintake.infrastructure.parsing.extraction;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Light, shape-based normalization of a matched phone substring to an E.164-like form
 * for the configured default country. No numbering-plan validation.
 */
@Getter
@Component
public class PhoneNumberNormalizer {

    public static final String DEFAULT_COUNTRY_CODE = "27";
    public static final String DEFAULT_TRUNK_PREFIX = "0";
    public static final int DEFAULT_NATIONAL_NUMBER_LENGTH = 9;

    private static final Pattern NON_DIALABLE = Pattern.compile("[^\\d+]");
    private static final Pattern INTERNATIONAL = Pattern.compile("\\+\\d+");

    private final String countryCode;
    private final String trunkPrefix;
    private final int nationalNumberLength;

    public PhoneNumberNormalizer() {
        this(DEFAULT_COUNTRY_CODE, DEFAULT_TRUNK_PREFIX, DEFAULT_NATIONAL_NUMBER_LENGTH);
    }

    @Autowired
    public PhoneNumberNormalizer(@Value("${contact-parser.phone.country-code:27}") String countryCode,
                                 @Value("${contact-parser.phone.trunk-prefix:0}") String trunkPrefix,
                                 @Value("${contact-parser.phone.national-number-length:9}") int nationalNumberLength) {
        if (countryCode == null || !countryCode.matches("\\d{1,3}")) {
            throw new IllegalArgumentException("Country code must be 1-3 digits: " + countryCode);
        }
        if (trunkPrefix == null || !trunkPrefix.matches("\\d{1,2}")) {
            throw new IllegalArgumentException("Trunk prefix must be 1-2 digits: " + trunkPrefix);
        }
        if (nationalNumberLength < 4 || nationalNumberLength > 14) {
            throw new IllegalArgumentException("National number length out of range: " + nationalNumberLength);
        }
        this.countryCode = countryCode;
        this.trunkPrefix = trunkPrefix;
        this.nationalNumberLength = nationalNumberLength;
    }

    /**
     * Normalize a raw phone match.
     *
     * @param raw substring matched by a phone shape
     * @return "+<country><national>" when a known shape applies, otherwise the trimmed raw text
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return raw;
        }
        String cleaned = NON_DIALABLE.matcher(raw).replaceAll("");
        // Only a leading '+' is meaningful
        if (cleaned.startsWith("+")) {
            cleaned = "+" + cleaned.substring(1).replace("+", "");
        } else {
            cleaned = cleaned.replace("+", "");
        }

        if (INTERNATIONAL.matcher(cleaned).matches()) {
            return cleaned;
        }
        if (cleaned.startsWith(countryCode) && cleaned.length() == countryCode.length() + nationalNumberLength) {
            return "+" + cleaned;
        }
        if (cleaned.startsWith(trunkPrefix) && cleaned.length() == trunkPrefix.length() + nationalNumberLength) {
            return "+" + countryCode + cleaned.substring(trunkPrefix.length());
        }
        if (cleaned.length() == nationalNumberLength) {
            return "+" + countryCode + cleaned;
        }
        return raw.strip();
    }
}
