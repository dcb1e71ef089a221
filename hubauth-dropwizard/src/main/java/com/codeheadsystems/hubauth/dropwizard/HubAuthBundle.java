package com.codeheadsystems.hubauth.dropwizard;

import com.codeheadsystems.hubauth.client.accessor.HubAuthorizationAccessor;
import com.codeheadsystems.hubauth.dropwizard.auth.HubCookieAuthFilter;
import com.codeheadsystems.hubauth.dropwizard.auth.HubCookieAuthenticator;
import com.codeheadsystems.hubauth.dropwizard.auth.HubLoginRedirectHandler;
import com.codeheadsystems.hubauth.dropwizard.auth.HubPrincipal;
import com.codeheadsystems.hubauth.dropwizard.errors.HubAccessorExceptionMapper;
import com.codeheadsystems.hubauth.dropwizard.health.HubCredentialHealthCheck;
import com.codeheadsystems.hubauth.dropwizard.resource.LogoutResource;
import com.codeheadsystems.hubauth.server.auth.CurrentIdentityResolver;
import com.codeheadsystems.hubauth.server.auth.HubLogoutAction;
import com.codeheadsystems.hubauth.server.auth.IdentityResolver;
import com.codeheadsystems.hubauth.server.auth.LogoutAction;
import com.codeheadsystems.hubauth.server.cache.CookieCache;
import com.codeheadsystems.hubauth.server.cache.CookieCacheExpiry;
import com.codeheadsystems.hubauth.server.cache.InMemoryCookieCache;
import com.codeheadsystems.hubauth.server.config.HubAuthSettings;
import com.codeheadsystems.hubauth.server.manager.HubCredentialStatus;
import com.codeheadsystems.hubauth.server.manager.TokenVerifier;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.net.http.HttpClient;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that puts a single-user server behind hub cookie authentication.
 * <p>
 * Registers the cookie auth filter (resources opt in with {@code @Auth HubPrincipal}), the
 * {@code /logout} redirect, the mapper turning hub failures into 500/502 responses, the
 * {@code hub-credential} health check, and the periodic cookie cache clear. Requires a
 * {@link HubAuthConfiguration} in the application's YAML config.
 * <pre>{@code
 *   bootstrap.addBundle(new HubAuthBundle<>());
 * }</pre>
 */
public class HubAuthBundle<C extends HubAuthConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(HubAuthBundle.class);

  private final CookieCache cookieCache;
  private CurrentIdentityResolver currentIdentityResolver;
  private LogoutAction logoutAction;

  /**
   * Creates a bundle with a process-local cookie cache.
   */
  public HubAuthBundle() {
    this(new InMemoryCookieCache());
  }

  /**
   * Creates a bundle with the supplied cookie cache.
   *
   * @param cookieCache the cookie cache
   */
  public HubAuthBundle(CookieCache cookieCache) {
    this.cookieCache = cookieCache;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    HubAuthSettings settings = configuration.toHubAuthSettings();
    log.info("Authenticating through the hub as {}", settings);

    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(settings.hubRequestTimeout())
        .build();
    HubAuthorizationAccessor accessor = new HubAuthorizationAccessor(
        httpClient, environment.getObjectMapper(), settings.hubConnectionInfo());
    HubCredentialStatus credentialStatus = new HubCredentialStatus();
    TokenVerifier tokenVerifier = new TokenVerifier(accessor, cookieCache, credentialStatus);
    currentIdentityResolver = new IdentityResolver(tokenVerifier, settings);
    logoutAction = new HubLogoutAction(settings);

    // cookie cache expiry
    ScheduledExecutorService scheduler = environment.lifecycle()
        .scheduledExecutorService("hubauth-cookie-cache-expiry-%d")
        .threads(1)
        .build();
    environment.lifecycle().manage(
        new CookieCacheExpiryManager(new CookieCacheExpiry(cookieCache, settings), scheduler));

    // cookie auth filter
    environment.jersey().register(new AuthDynamicFeature(
        new HubCookieAuthFilter.Builder()
            .setAuthenticator(new HubCookieAuthenticator(currentIdentityResolver))
            .setUnauthorizedHandler(new HubLoginRedirectHandler(settings.loginLocation()))
            .setPrefix(HubCookieAuthFilter.AUTHENTICATION_SCHEME)
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(HubPrincipal.class));
    environment.jersey().register(new HubAccessorExceptionMapper());
    environment.jersey().register(new LogoutResource(logoutAction));

    environment.healthChecks().register("hub-credential", new HubCredentialHealthCheck(credentialStatus));
  }

  /**
   * The resolver wired into the auth filter, for hosts that need the current user outside
   * {@code @Auth} parameters. Available once {@link #run} has completed.
   *
   * @return the current identity resolver
   */
  public CurrentIdentityResolver getCurrentIdentityResolver() {
    return currentIdentityResolver;
  }

  /**
   * The logout action behind {@code /logout}. Available once {@link #run} has completed.
   *
   * @return the logout action
   */
  public LogoutAction getLogoutAction() {
    return logoutAction;
  }

  /**
   * The cookie cache shared by all requests.
   *
   * @return the cookie cache
   */
  public CookieCache getCookieCache() {
    return cookieCache;
  }
}
