package com.example.rdsiamdatasource.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.example.rdsiamdatasource.core.RdsIamException;
import com.example.rdsiamdatasource.core.RdsIamException.Reason;
import com.example.rdsiamdatasource.core.iam.CredentialResolver;
import com.example.rdsiamdatasource.core.iam.RdsIamAuthenticator;
import com.example.rdsiamdatasource.core.iam.RdsIamConfig;
import com.example.rdsiamdatasource.core.iam.SigningCredentials;
import com.example.rdsiamdatasource.core.iam.TokenSigner;
import com.example.rdsiamdatasource.core.url.ConnectionStringCodec;
import java.sql.Connection;
import java.sql.Driver;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.regions.Region;

class RdsIamDataSourceTest {

  private static final String BASE = "postgres://iam_user@db.local:5432/app?sslmode=require";

  private final AtomicReference<Instant> now =
      new AtomicReference<>(Instant.parse("2024-01-01T00:00:00Z"));
  private final AtomicInteger tokens = new AtomicInteger();

  private Driver driver;
  private TokenSigner signer;
  private RdsIamAuthenticator authenticator;
  private RdsIamDataSource dataSource;

  @BeforeEach
  void setUp() throws SQLException {
    driver = mock(Driver.class);
    when(driver.connect(anyString(), any())).thenAnswer(inv -> mock(Connection.class));

    signer = mock(TokenSigner.class);
    when(signer.sign(anyString(), any(), anyString(), any()))
        .thenAnswer(inv -> "tok/" + tokens.incrementAndGet() + "+=");

    final CredentialResolver resolver =
        region -> new SigningCredentials(Region.EU_WEST_1, AnonymousCredentialsProvider.create());

    authenticator =
        RdsIamAuthenticator.builder()
            .config(
                RdsIamConfig.builder()
                    .enabled(true)
                    .tokenRefreshInterval(Duration.ofMinutes(14))
                    .build())
            .endpoint("db.local:5432")
            .dbUser("iam_user")
            .baseConnectionString(BASE)
            .credentialResolver(resolver)
            .tokenSigner(signer)
            .clock(
                new Clock() {
                  @Override
                  public ZoneId getZone() {
                    return ZoneOffset.UTC;
                  }

                  @Override
                  public Clock withZone(final ZoneId zone) {
                    return this;
                  }

                  @Override
                  public Instant instant() {
                    return now.get();
                  }
                })
            .build();
    dataSource = new RdsIamDataSource(authenticator, driver);
  }

  @AfterEach
  void tearDown() {
    dataSource.shutdown();
  }

  @Test
  @DisplayName("Opens connections with a JDBC URL and token credentials")
  void shouldConnectWithToken() throws SQLException {
    final var props = ArgumentCaptor.forClass(Properties.class);

    assertNotNull(dataSource.getConnection());

    verify(driver)
        .connect(eq("jdbc:postgresql://db.local:5432/app?sslmode=require"), props.capture());
    assertEquals("iam_user", props.getValue().getProperty("user"));
    assertEquals("tok/1+=", props.getValue().getProperty("password"));
  }

  @Test
  @DisplayName("Reuses the token inside the interval and refreshes it after")
  void shouldUseFreshTokenPerOpen() throws SQLException {
    final var props = ArgumentCaptor.forClass(Properties.class);

    dataSource.getConnection();
    now.set(now.get().plus(Duration.ofMinutes(10)));
    dataSource.getConnection();
    now.set(now.get().plus(Duration.ofMinutes(10)));
    dataSource.getConnection();

    verify(driver, times(3)).connect(anyString(), props.capture());
    assertEquals("tok/1+=", props.getAllValues().get(0).getProperty("password"));
    assertEquals("tok/1+=", props.getAllValues().get(1).getProperty("password"));
    assertEquals("tok/2+=", props.getAllValues().get(2).getProperty("password"));
  }

  @Test
  @DisplayName("Makes no driver call when the token cannot be refreshed")
  void shouldNotDialWhenRefreshFails() throws SQLException {
    when(signer.sign(anyString(), any(), anyString(), any()))
        .thenThrow(new RuntimeException("ExpiredToken"));

    final var ex = assertThrows(SQLException.class, dataSource::getConnection);

    assertEquals("08001", ex.getSQLState());
    final var cause = assertInstanceOf(RdsIamException.class, ex.getCause());
    assertEquals(Reason.TOKEN_SIGNING_FAILED, cause.reason());
    verify(driver, never()).connect(anyString(), any());
  }

  @Test
  @DisplayName("Reports a driver that does not accept the URL")
  void shouldFailWhenDriverReturnsNull() throws SQLException {
    when(driver.connect(anyString(), any())).thenReturn(null);

    final var ex = assertThrows(SQLException.class, dataSource::getConnection);

    assertEquals("08001", ex.getSQLState());
    assertFalse(ex.getMessage().contains("tok/"));
  }

  @Test
  @DisplayName("Does not accept caller supplied credentials")
  void shouldRejectExplicitCredentials() {
    assertThrows(UnsupportedOperationException.class, () -> dataSource.getConnection("u", "p"));
  }

  @Test
  @DisplayName("Unwraps to itself only")
  void shouldUnwrap() throws SQLException {
    assertTrue(dataSource.isWrapperFor(RdsIamDataSource.class));
    assertSame(dataSource, dataSource.unwrap(RdsIamDataSource.class));
    assertThrows(SQLException.class, () -> dataSource.unwrap(String.class));
  }

  @Test
  @DisplayName("Rejects unknown driver names")
  void shouldRejectUnknownDriverName() {
    assertThrows(SQLException.class, () -> RdsIamDataSource.forDriver("oracle", authenticator));
  }

  @Test
  @DisplayName("Builds JDBC URLs for both schemes")
  void shouldBuildJdbcUrls() {
    assertEquals(
        "jdbc:mysql://db.local/app?tls=true",
        ConnectionStringCodec.parse("mysql://u:p@db.local/app?tls=true").jdbcUrl());
    assertEquals(
        "jdbc:postgresql://[::1]:5433",
        ConnectionStringCodec.parse("postgres://u@[::1]:5433").jdbcUrl());
  }
}
