package com.codeheadsystems.hubauth.dropwizard;

import static org.mockito.Mockito.verify;

import com.codeheadsystems.hubauth.server.cache.CookieCacheExpiry;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CookieCacheExpiryManagerTest {

  @Mock private CookieCacheExpiry expiry;
  @Mock private ScheduledExecutorService scheduler;

  @Test
  void startAndStop_driveTheExpiry() {
    CookieCacheExpiryManager manager = new CookieCacheExpiryManager(expiry, scheduler);

    manager.start();
    manager.stop();

    verify(expiry).start(scheduler);
    verify(expiry).stop();
  }
}
