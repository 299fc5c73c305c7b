package com.taxana.tax;

import com.taxana.domain.SwapRecord;
import com.taxana.tax.config.TaxProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Classifies a swap by which legs are base tokens.
 */
@Component
@RequiredArgsConstructor
public class SwapClassifier {

    private final TaxProperties taxProperties;

    public SwapType classify(SwapRecord record) {
        boolean fromBase = isBaseToken(record.getFromToken());
        boolean toBase = isBaseToken(record.getToToken());
        if (fromBase && toBase) {
            return SwapType.BASE_SWAP;
        }
        if (fromBase) {
            return SwapType.ACQUISITION;
        }
        if (toBase) {
            return SwapType.DISPOSAL;
        }
        return SwapType.TOKEN_SWAP;
    }

    public boolean isBaseToken(String token) {
        return token != null && taxProperties.getBaseTokens().contains(token);
    }
}
