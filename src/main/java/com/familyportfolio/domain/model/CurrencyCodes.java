package com.familyportfolio.domain.model;

import com.familyportfolio.domain.exception.Error;
import com.familyportfolio.domain.exception.ServiceException;

import java.util.Locale;

/**
 * ISO 4217 style three-letter currency codes.
 */
public final class CurrencyCodes {

    private CurrencyCodes() {
    }

    public static String normalize(String code, Error error) {
        if (code == null || code.trim().length() != 3) {
            throw new ServiceException(error, "Currency code must be a 3-letter ISO code: " + code);
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean same(String left, String right) {
        return left != null && right != null && left.trim().equalsIgnoreCase(right.trim());
    }
}
