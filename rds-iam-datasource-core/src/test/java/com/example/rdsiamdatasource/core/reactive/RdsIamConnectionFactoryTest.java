package com.example.rdsiamdatasource.core.reactive;

import static io.r2dbc.spi.ConnectionFactoryOptions.DATABASE;
import static io.r2dbc.spi.ConnectionFactoryOptions.DRIVER;
import static io.r2dbc.spi.ConnectionFactoryOptions.HOST;
import static io.r2dbc.spi.ConnectionFactoryOptions.PASSWORD;
import static io.r2dbc.spi.ConnectionFactoryOptions.PORT;
import static io.r2dbc.spi.ConnectionFactoryOptions.USER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.example.rdsiamdatasource.core.RdsIamException;
import com.example.rdsiamdatasource.core.RdsIamException.Reason;
import com.example.rdsiamdatasource.core.iam.RdsIamAuthenticator;
import com.example.rdsiamdatasource.core.iam.RdsIamConfig;
import com.example.rdsiamdatasource.core.iam.SigningCredentials;
import com.example.rdsiamdatasource.core.iam.TokenSigner;
import com.example.rdsiamdatasource.core.url.ConnectionStringCodec;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryOptions;
import io.r2dbc.spi.Option;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.*;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.regions.Region;

class RdsIamConnectionFactoryTest {

  private static final String BASE =
      "postgres://iam_user@db.local:5432/app?sslMode=require&application_name=my%20app";

  private TokenSigner signer;
  private RdsIamAuthenticator authenticator;
  private ConnectionFactory delegate;
  private Connection connection;
  private final List<ConnectionFactoryOptions> seen = new ArrayList<>();

  @BeforeEach
  void setUp() {
    signer = mock(TokenSigner.class);
    when(signer.sign(anyString(), any(), anyString(), any())).thenReturn("token/with+chars=");
    authenticator =
        RdsIamAuthenticator.builder()
            .config(RdsIamConfig.builder().enabled(true).build())
            .endpoint("db.local:5432")
            .dbUser("iam_user")
            .baseConnectionString(BASE)
            .credentialResolver(
                region ->
                    new SigningCredentials(
                        Region.EU_WEST_1, AnonymousCredentialsProvider.create()))
            .tokenSigner(signer)
            .build();

    connection = mock(Connection.class);
    delegate = mock(ConnectionFactory.class);
    doReturn(Mono.just(connection)).when(delegate).create();
    seen.clear();
  }

  private RdsIamConnectionFactory factory() {
    return new RdsIamConnectionFactory(
        authenticator,
        "postgresql",
        options -> {
          seen.add(options);
          return delegate;
        });
  }

  @Test
  @DisplayName("Creates a connection with options carrying the current token")
  void shouldCreateWithToken() {
    StepVerifier.create(factory().create()).expectNext(connection).verifyComplete();

    assertEquals(1, seen.size());
    final var options = seen.get(0);
    assertEquals("postgresql", options.getValue(DRIVER));
    assertEquals("db.local", options.getValue(HOST));
    assertEquals(5432, options.getValue(PORT));
    assertEquals("app", options.getValue(DATABASE));
    assertEquals("iam_user", options.getValue(USER));
    assertEquals("token/with+chars=", options.getValue(PASSWORD));
    assertEquals("require", options.getValue(Option.valueOf("sslMode")));
    assertEquals("my app", options.getValue(Option.valueOf("application_name")));
  }

  @Test
  @DisplayName("Looks the token up again for every connection")
  void shouldLookUpPerCreate() {
    final var factory = factory();

    StepVerifier.create(factory.create()).expectNext(connection).verifyComplete();
    StepVerifier.create(factory.create()).expectNext(connection).verifyComplete();

    assertEquals(2, seen.size());
    verify(delegate, times(2)).create();
  }

  @Test
  @DisplayName("Signals the refresh failure and never reaches the driver")
  void shouldErrorWhenRefreshFails() {
    when(signer.sign(anyString(), any(), anyString(), any()))
        .thenThrow(new RuntimeException("AccessDenied"));

    StepVerifier.create(factory().create())
        .expectErrorSatisfies(
            e -> {
              final var ex = assertInstanceOf(RdsIamException.class, e);
              assertEquals(Reason.TOKEN_SIGNING_FAILED, ex.reason());
            })
        .verify();

    assertTrue(seen.isEmpty());
    verify(delegate, never()).create();
  }

  @Test
  @DisplayName("Uses the default port when the string has none and skips reserved options")
  void shouldMapOptions() {
    final var options =
        factory()
            .toOptions(
                ConnectionStringCodec.parse(
                    "mysql://u:p@db.local/shop?user=evil&connectTimeout=5"));

    assertEquals(3306, options.getValue(PORT));
    assertEquals("u", options.getValue(USER));
    assertEquals("5", options.getValue(Option.valueOf("connectTimeout")));
  }

  @Test
  @DisplayName("Resolves driver names and rejects unknown ones")
  void shouldResolveDriverNames() {
    assertEquals(
        "RDS IAM (mysql)",
        RdsIamConnectionFactory.forDriver("mysql", authenticator).getMetadata().getName());
    assertEquals(
        "RDS IAM (postgresql)", new RdsIamConnectionFactory(authenticator).getMetadata().getName());
    assertThrows(
        IllegalArgumentException.class,
        () -> RdsIamConnectionFactory.forDriver("mssql", authenticator));
  }
}
