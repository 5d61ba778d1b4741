package com.freightplatform.loadservice.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class MoneyUtil {

    private MoneyUtil(){}

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    // Offered rates are optional on a load, unlike ledger amounts
    public static BigDecimal format(BigDecimal amount) {
        if (amount == null) return null;
        return amount.setScale(SCALE, ROUNDING);
    }

}
