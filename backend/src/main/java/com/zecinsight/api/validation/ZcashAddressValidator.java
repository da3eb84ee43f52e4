package com.zecinsight.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

/**
 * Format check only; checksums are verified by the Payment Gateway when it sends funds.
 */
public class ZcashAddressValidator implements ConstraintValidator<ZcashAddress, String> {

    /** Base58, 35 chars. */
    private static final Pattern TRANSPARENT = Pattern.compile("^t[13][1-9A-HJ-NP-Za-km-z]{33}$");
    /** Bech32, 78 chars. */
    private static final Pattern SAPLING = Pattern.compile("^zs1[02-9ac-hj-np-z]{75}$");
    /** Bech32m, length depends on the receivers it carries. */
    private static final Pattern UNIFIED = Pattern.compile("^u1[02-9ac-hj-np-z]{50,1000}$");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return isValidAddress(value);
    }

    public static boolean isValidAddress(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        return TRANSPARENT.matcher(v).matches() || SAPLING.matcher(v).matches() || UNIFIED.matcher(v).matches();
    }
}
