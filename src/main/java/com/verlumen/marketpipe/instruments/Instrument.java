package com.verlumen.marketpipe.instruments;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.List;

/**
 * A tradable instrument: a stock ticker or a crypto pair on a given venue.
 *
 * <p>Instruments are immutable. Crypto symbols are normalised through {@link CurrencyPair} so that
 * "btc-usdt" and "BTC/USDT" name the same instrument.
 */
@AutoValue
public abstract class Instrument {
  private static final CharMatcher UNSAFE_KEY_CHARS =
      CharMatcher.inRange('A', 'Z')
          .or(CharMatcher.inRange('a', 'z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("._"))
          .negate();

  public static Instrument create(String symbol, AssetClass assetClass, String venue) {
    checkArgument(!symbol.isBlank(), "Instrument symbol must not be blank");
    checkArgument(!venue.isBlank(), "Instrument venue must not be blank");
    String normalized =
        assetClass == AssetClass.CRYPTO
            ? CurrencyPair.fromSymbol(symbol).symbol()
            : symbol.trim().toUpperCase();
    return new AutoValue_Instrument(normalized, assetClass, venue.trim().toLowerCase());
  }

  public static Instrument crypto(String pairSymbol, String venue) {
    return create(pairSymbol, AssetClass.CRYPTO, venue);
  }

  public static Instrument equity(String ticker, String venue) {
    return create(ticker, AssetClass.EQUITY, venue);
  }

  /**
   * Parses the command-line form {@code <assetClass>:<symbol>@<venue>}, for example
   * {@code crypto:BTC/USDT@binance} or {@code equity:AAPL@nasdaq}.
   */
  public static Instrument parse(String spec) {
    List<String> classAndRest = Splitter.on(':').limit(2).trimResults().splitToList(spec);
    checkArgument(classAndRest.size() == 2, "Expected <assetClass>:<symbol>@<venue> but got %s", spec);
    List<String> symbolAndVenue = Splitter.on('@').limit(2).trimResults().splitToList(classAndRest.get(1));
    checkArgument(
        symbolAndVenue.size() == 2, "Expected <assetClass>:<symbol>@<venue> but got %s", spec);
    return create(
        symbolAndVenue.get(0), AssetClass.fromString(classAndRest.get(0)), symbolAndVenue.get(1));
  }

  public abstract String symbol();

  public abstract AssetClass assetClass();

  public abstract String venue();

  /**
   * Filesystem and object-store safe path naming the instrument, e.g. {@code crypto/binance/BTC-USDT}
   * or {@code equity/nasdaq/AAPL}. Distinct instruments never share a key.
   */
  public String storageKey() {
    return assetClass().name().toLowerCase()
        + "/"
        + UNSAFE_KEY_CHARS.replaceFrom(venue(), '-')
        + "/"
        + UNSAFE_KEY_CHARS.replaceFrom(symbol(), '-');
  }

  /** The pair form of a crypto instrument. */
  public CurrencyPair currencyPair() {
    checkArgument(assetClass() == AssetClass.CRYPTO, "%s is not a crypto instrument", symbol());
    return CurrencyPair.fromSymbol(symbol());
  }

  @Override
  public final String toString() {
    return symbol();
  }
}
