package com.cookapi.jobclient.auth;

import com.cookapi.jobclient.client.JobClientConfigurationException;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthModeTest {

    @Test
    void fromConfig_acceptsCaseAndDashVariants() {
        assertThat(AuthMode.fromConfig("http_basic")).isEqualTo(AuthMode.HTTP_BASIC);
        assertThat(AuthMode.fromConfig("HTTP-Basic")).isEqualTo(AuthMode.HTTP_BASIC);
        assertThat(AuthMode.fromConfig(" kerberos ")).isEqualTo(AuthMode.KERBEROS);
    }

    @Test
    void fromConfig_unknownOrNull_throwsListingSupportedModes() {
        assertThatThrownBy(() -> AuthMode.fromConfig("ntlm"))
                .isInstanceOf(JobClientConfigurationException.class)
                .hasMessage("Authentication type ntlm not supported (expected one of http_basic, kerberos)");
        assertThatThrownBy(() -> AuthMode.fromConfig(null))
                .isInstanceOf(JobClientConfigurationException.class);
    }

    @Test
    void basicAuthenticator_encodesUserAndPassword() {
        BasicAuthenticator auth = new BasicAuthenticator("Aladdin", "open sesame");

        assertThat(auth.authorizationHeader(URI.create("http://localhost:12321/rawscheduler")))
                .contains("Basic QWxhZGRpbjpvcGVuIHNlc2FtZQ==");
        assertThat(auth.toString()).doesNotContain("open sesame");
    }
}
