package io.github.eprintharvester.dagger;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dagger.Module;
import dagger.Provides;
import io.github.eprintharvester.helper.Sleeper;
import io.github.eprintharvester.helper.ThreadSleeper;
import java.time.Clock;
import java.util.Random;
import javax.inject.Singleton;

/**
 * Process-wide helpers: JSON mapper, clock, jitter source and sleeper.
 */
@Module
public class CommonModule {

  private final Sleeper sleeper;

  /**
   * Instantiates a new Common module that sleeps on the calling thread.
   */
  public CommonModule() {
    this(new ThreadSleeper());
  }

  /**
   * Instantiates a new Common module with a custom sleeper.
   *
   * @param sleeper the sleeper
   */
  public CommonModule(final Sleeper sleeper) {
    this.sleeper = sleeper;
  }

  /**
   * Object mapper for JSON serialization.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    final ObjectMapper objectMapper = new ObjectMapper();
    // Java 8 date/time and Optional support
    objectMapper.findAndRegisterModules();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
    return objectMapper;
  }

  /**
   * Sleeper.
   *
   * @return the sleeper
   */
  @Provides
  @Singleton
  public Sleeper sleeper() {
    return sleeper;
  }

  /**
   * Clock.
   *
   * @return the clock
   */
  @Provides
  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Jitter source for retry backoff.
   *
   * @return the random
   */
  @Provides
  @Singleton
  public Random random() {
    return new Random();
  }
}
