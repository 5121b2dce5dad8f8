package io.changefeed.spring.boot;

import io.changefeed.ChangeListener;
import io.changefeed.model.Delivery;
import io.changefeed.model.EventKind;
import io.changefeed.model.PriorityTier;
import io.changefeed.spi.RawChange;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChangeSubscriptionRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(ChangeFeedAutoConfiguration.class))
      .withUserConfiguration(FeedConfig.class);

  @Test
  void subscribesAnnotatedListeners() {
    runner.withUserConfiguration(ListenerConfig.class).run(ctx -> {
      var feed = ctx.getBean(RecordingChangeFeed.class);
      assertEquals(List.of("likeCounter"), feed.opened);
      assertEquals("likes", feed.specs.get("likeCounter").table());
      assertEquals("post_id=eq.1", feed.specs.get("likeCounter").filter());
      assertEquals(1, ctx.getBean(ChangeSubscriptionRegistrar.class).subscriptionCount());
    });
  }

  @Test
  void deliversChangesToAnnotatedListener() {
    runner.withUserConfiguration(ListenerConfig.class).run(ctx -> {
      var feed = ctx.getBean(RecordingChangeFeed.class);
      var counter = ctx.getBean(LikeCounter.class);

      feed.listeners.get("likeCounter").onChange(
          new RawChange("INSERT", "likes", null, Map.of("post_id", 1, "user_id", 7)));

      assertTrue(counter.received.await(5, TimeUnit.SECONDS));
      assertEquals(1, counter.deliveries.get(0).count());
    });
  }

  @Test
  void explicitChannelNameWins() {
    runner.withUserConfiguration(NamedChannelConfig.class).run(ctx -> {
      var feed = ctx.getBean(RecordingChangeFeed.class);
      assertEquals(List.of("comments-feed"), feed.opened);
      assertEquals(EventKind.ANY, feed.specs.get("comments-feed").eventKind());
    });
  }

  @Test
  void unsubscribesWhenContextCloses() {
    var feed = new RecordingChangeFeed[1];
    runner.withUserConfiguration(ListenerConfig.class).run(ctx -> feed[0] = ctx.getBean(RecordingChangeFeed.class));

    assertEquals(List.of("likeCounter"), feed[0].closed);
  }

  @Test
  void rejectsBeanThatIsNotAListener() {
    runner.withUserConfiguration(NotAListenerConfig.class).run(ctx -> {
      Throwable failure = ctx.getStartupFailure();
      assertNotNull(failure);
      assertTrue(failure.getMessage().contains("must implement ChangeListener"));
    });
  }

  @Configuration
  static class FeedConfig {
    @Bean
    RecordingChangeFeed changeFeed() {
      return new RecordingChangeFeed();
    }
  }

  @ChangeSubscription(table = "likes", filter = "post_id=eq.1", event = EventKind.INSERT,
      priority = PriorityTier.CRITICAL)
  static class LikeCounter implements ChangeListener {
    final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    final CountDownLatch received = new CountDownLatch(1);

    @Override
    public void onChange(Delivery delivery) {
      deliveries.add(delivery);
      received.countDown();
    }
  }

  @Configuration
  static class ListenerConfig {
    @Bean
    LikeCounter likeCounter() {
      return new LikeCounter();
    }
  }

  @ChangeSubscription(table = "comments", channel = "comments-feed")
  static class CommentListener implements ChangeListener {
    @Override
    public void onChange(Delivery delivery) {
    }
  }

  @Configuration
  static class NamedChannelConfig {
    @Bean
    CommentListener commentListener() {
      return new CommentListener();
    }
  }

  @ChangeSubscription(table = "likes")
  static class NotAListener {
  }

  @Configuration
  static class NotAListenerConfig {
    @Bean
    NotAListener notAListener() {
      return new NotAListener();
    }
  }
}
