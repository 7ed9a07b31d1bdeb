package com.notekeeper.api.security;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtBeansTest {

  private static JwtBeans beans(String secret, String... profiles) {
    var env = new MockEnvironment();
    env.setActiveProfiles(profiles);
    return new JwtBeans(env, new AuthProperties(secret, "notekeeper", 60, 4));
  }

  @Test
  void blankSecretRefusesToStartOutsideDevAndTest() {
    assertThatThrownBy(() -> beans("  ").jwtEncoder())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("NOTEKEEPER_JWT_SECRET");
    assertThatThrownBy(() -> beans(null, "prod").signingKey(null))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void blankSecretFallsBackToDevSecretUnderDevOrTestProfile() {
    byte[] expected = JwtBeans.deriveKey(JwtBeans.DEV_SECRET);

    assertThat(beans("", "dev").signingKey("")).isEqualTo(expected);
    assertThat(beans(null, "test").signingKey(null)).isEqualTo(expected);
  }

  @Test
  void configuredSecretIsDerivedToA32ByteKey() {
    byte[] key = beans("s3cret", "prod").signingKey(" s3cret ");

    assertThat(key).hasSize(32).isEqualTo(JwtBeans.deriveKey("s3cret"));
    assertThat(key).isNotEqualTo(JwtBeans.deriveKey(JwtBeans.DEV_SECRET));
  }
}
