package com.verlumen.marketpipe.instruments;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.MoreCollectors.onlyElement;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * A trading pair, a base asset quoted in a counter asset.
 *
 * <p>"BTC/USDT" is the price of one bitcoin in tether. Exchanges spell the same pair differently
 * ("BTC-USDT", "BTCUSDT"); this type is the canonical form used as an instrument symbol.
 */
public record CurrencyPair(Currency base, Currency counter) implements Serializable {
  // Constants for possible delimiters in the currency pair symbol.
  private static final String FORWARD_SLASH = "/";
  private static final String HYPHEN = "-";

  /**
   * Creates a {@link CurrencyPair} from a given symbol.
   *
   * <p>The symbol should use either "/" or "-" as a delimiter, for example:
   *
   * <ul>
   *   <li>"BTC/USDT"</li>
   *   <li>"eth-usdt"</li>
   * </ul>
   *
   * @param symbol a string representing the pair.
   * @return the parsed pair, upper-cased.
   * @throws IllegalArgumentException if the symbol is invalid, ambiguous, or does not contain
   *     exactly two distinct assets.
   */
  public static CurrencyPair fromSymbol(String symbol) {
    ImmutableList<String> symbolParts = splitSymbol(symbol);
    Currency base = Currency.create(symbolParts.get(0));
    Currency counter = Currency.create(symbolParts.get(1));
    return new CurrencyPair(base, counter);
  }

  private static ImmutableList<String> splitSymbol(String symbol) {
    try {
      String delimiter =
          Stream.of(FORWARD_SLASH, HYPHEN).filter(symbol::contains).collect(onlyElement());

      Splitter splitter = Splitter.on(delimiter).trimResults().omitEmptyStrings();

      ImmutableList<String> parts =
          splitter.splitToStream(symbol).map(String::toUpperCase).distinct().collect(toImmutableList());

      checkArgument(parts.size() == 2, "Symbol must contain exactly two currencies: %s", symbol);

      return parts;
    } catch (NoSuchElementException | IllegalArgumentException | NullPointerException e) {
      throw new IllegalArgumentException(
          String.format("Unable to parse currency pair, invalid symbol: \"%s\".", symbol), e);
    }
  }

  public String symbol() {
    return base().symbol() + FORWARD_SLASH + counter().symbol();
  }

  /** The pair without a delimiter, as Binance expects it ("BTCUSDT"). */
  public String concatenatedSymbol() {
    return base().symbol() + counter().symbol();
  }
}
