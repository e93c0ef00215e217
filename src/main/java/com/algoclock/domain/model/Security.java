package com.algoclock.domain.model;

import com.algoclock.calendar.ExchangeHours;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A tradeable instrument as seen by the scheduler: a symbol and the hours of the exchange it
 * trades on. Identity is the symbol.
 */
@Getter
@Builder
@ToString(of = {"symbol", "extendedMarketHours"})
@EqualsAndHashCode(of = "symbol")
public class Security {

    private final String symbol;
    private final ExchangeHours exchangeHours;

    /** Whether the algorithm subscribed to pre- and post-market data for this security. */
    private final boolean extendedMarketHours;
}
