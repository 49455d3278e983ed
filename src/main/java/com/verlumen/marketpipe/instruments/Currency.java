package com.verlumen.marketpipe.instruments;

import java.io.Serializable;

/**
 * Represents a currency or crypto asset with a unique symbol.
 *
 * A {@link Currency} is one leg of a {@link CurrencyPair}, e.g. "BTC" or "USDT".
 */
public record Currency(String symbol) implements Serializable {
  /**
   * Factory method to create a {@link Currency} instance.
   *
   * @param symbol the asset symbol, e.g. "USD", "BTC" or "USDT".
   * @return a new {@link Currency} instance with the given symbol.
   * @throws IllegalArgumentException if the symbol is null or empty.
   */
  static Currency create(String symbol) {
    if (symbol == null || symbol.isEmpty()) {
      throw new IllegalArgumentException("Currency symbol must not be null or empty.");
    }
    return new Currency(symbol);
  }
}
