package com.verlumen.marketpipe.marketdata;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.gson.JsonArray;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.marketpipe.http.HttpClient;
import com.verlumen.marketpipe.http.HttpStatusException;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.time.TimeFrame;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class BinanceKlineAdapterTest {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
  private static final Instrument BTC_USDT = Instrument.crypto("BTC/USDT", "binance");

  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock @Bind private HttpClient mockHttpClient;

  @Bind
  private MarketDataConfig config = MarketDataConfig.create(T0, TimeFrame.ONE_MIN, "");

  @Inject private BinanceKlineAdapter adapter;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void fetch_skipsKlineStillOpenAtUntil() throws Exception {
    // Arrange
    JsonArray klines = new JsonArray();
    for (int minute = 0; minute < 4; minute++) {
      klines.add(kline(T0.plus(Duration.ofMinutes(minute)), 100.0 + minute));
    }
    when(mockHttpClient.get(anyString(), anyMap())).thenReturn(klines.toString());
    Instant until = T0.plus(Duration.ofMinutes(3));

    // Act
    FetchResult result = adapter.fetch(BTC_USDT, CursorPosition.start(), until);

    // Assert
    assertThat(result.observations()).hasSize(3);
    assertThat(result.observations().get(2).close()).isEqualTo(102.0);
    assertThat(result.observations().get(0).attributes()).containsKey("num_trades");
    assertThat(result.nextPosition()).isEqualTo(CursorPosition.at(T0.plus(Duration.ofMinutes(2))));
    assertThat(result.hasMore()).isFalse();
  }

  @Test
  public void fetch_resumesOneMillisecondAfterCursor() throws Exception {
    // Arrange
    when(mockHttpClient.get(anyString(), anyMap())).thenReturn("[]");
    Instant last = T0.plus(Duration.ofMinutes(1));

    // Act
    FetchResult result =
        adapter.fetch(BTC_USDT, CursorPosition.at(last), T0.plus(Duration.ofHours(1)));

    // Assert
    assertThat(result.observations()).isEmpty();
    assertThat(result.nextPosition()).isEqualTo(CursorPosition.at(last));
    verify(mockHttpClient)
        .get(contains("symbol=BTCUSDT&interval=1m&limit=1000&startTime=" + (last.toEpochMilli() + 1)), anyMap());
  }

  @Test
  public void fetch_serverError_throwsTransient() throws Exception {
    // Arrange
    when(mockHttpClient.get(anyString(), anyMap()))
        .thenThrow(new HttpStatusException(503, "Failed to fetch data: HTTP code 503"));

    // Act & Assert
    TransientSourceException thrown =
        assertThrows(
            TransientSourceException.class,
            () -> adapter.fetch(BTC_USDT, CursorPosition.start(), T0.plus(Duration.ofHours(1))));
    assertThat(thrown.isRetryable()).isTrue();
  }

  @Test
  public void fetch_connectionFailure_throwsTransient() throws Exception {
    // Arrange
    when(mockHttpClient.get(anyString(), anyMap())).thenThrow(new IOException("reset"));

    // Act & Assert
    assertThrows(
        TransientSourceException.class,
        () -> adapter.fetch(BTC_USDT, CursorPosition.start(), T0.plus(Duration.ofHours(1))));
  }

  @Test
  public void fetch_badRequest_throwsPermanent() throws Exception {
    // Arrange
    when(mockHttpClient.get(anyString(), anyMap()))
        .thenThrow(new HttpStatusException(400, "Failed to fetch data: HTTP code 400"));

    // Act & Assert
    PermanentSourceException thrown =
        assertThrows(
            PermanentSourceException.class,
            () -> adapter.fetch(BTC_USDT, CursorPosition.start(), T0.plus(Duration.ofHours(1))));
    assertThat(thrown.isRetryable()).isFalse();
  }

  @Test
  public void fetch_errorObjectPayload_throwsPermanent() throws Exception {
    // Arrange
    when(mockHttpClient.get(anyString(), anyMap()))
        .thenReturn("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}");

    // Act & Assert
    assertThrows(
        PermanentSourceException.class,
        () -> adapter.fetch(BTC_USDT, CursorPosition.start(), T0.plus(Duration.ofHours(1))));
  }

  @Test
  public void supports_onlyBinanceCryptoPairs() {
    assertThat(adapter.supports(BTC_USDT)).isTrue();
    assertThat(adapter.supports(Instrument.crypto("BTC/USDT", "kraken"))).isFalse();
    assertThat(adapter.supports(Instrument.equity("AAPL", "binance"))).isFalse();
  }

  private static JsonArray kline(Instant openTime, double close) {
    JsonArray kline = new JsonArray();
    kline.add(openTime.toEpochMilli());
    kline.add(String.valueOf(close - 1));
    kline.add(String.valueOf(close + 1));
    kline.add(String.valueOf(close - 2));
    kline.add(String.valueOf(close));
    kline.add("12.5");
    kline.add(openTime.plus(Duration.ofMinutes(1)).minusMillis(1).toEpochMilli());
    kline.add("1250.0");
    kline.add(42);
    kline.add("6.0");
    kline.add("600.0");
    kline.add("0");
    return kline;
  }
}
