package io.changefeed.cache;

import java.util.Objects;
import java.util.function.Function;

/**
 * Converts cached values to and from the remote cache's string representation.
 *
 * @param <T> value type
 */
public interface ValueCodec<T> {

  /**
   * Identity codec for string values.
   */
  ValueCodec<String> STRING = of(Function.identity(), Function.identity());

  String encode(T value);

  /**
   * @param encoded the stored string
   * @return the value
   * @throws RuntimeException if {@code encoded} is not a valid representation; the
   *     read-through cache then treats the entry as a miss
   */
  T decode(String encoded);

  static <T> ValueCodec<T> of(Function<? super T, String> encoder, Function<String, ? extends T> decoder) {
    Objects.requireNonNull(encoder, "encoder");
    Objects.requireNonNull(decoder, "decoder");
    return new ValueCodec<>() {
      @Override
      public String encode(T value) {
        return encoder.apply(value);
      }

      @Override
      public T decode(String encoded) {
        return decoder.apply(encoded);
      }
    };
  }
}
