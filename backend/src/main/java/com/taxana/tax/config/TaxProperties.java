package com.taxana.tax.config;

import com.taxana.common.SolanaTokens;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * Jurisdiction settings for the tax engine. Defaults are Indonesian final taxes for trades on an unregistered
 * exchange. Documented in application.yml under taxana.tax.
 */
@ConfigurationProperties(prefix = "taxana.tax")
@Getter
@Setter
public class TaxProperties {

    /**
     * Income tax (PPh) on the value of a disposal: 0.2%.
     */
    private BigDecimal saleTaxRate = new BigDecimal("0.002");

    /**
     * VAT (PPN) on the value of an acquisition: 0.22%.
     */
    private BigDecimal purchaseTaxRate = new BigDecimal("0.0022");

    /**
     * Cash-equivalent mints: native SOL and the major stablecoins. Swaps into or out of them are
     * acquisitions or disposals of the other leg.
     */
    private Set<String> baseTokens = new HashSet<>(SolanaTokens.DEFAULT_BASE_TOKENS);

    private BaseSwapTreatment baseSwapTreatment = BaseSwapTreatment.DISPOSAL;

    /**
     * Decimal places kept when splitting lots.
     */
    private int scale = 18;
}
