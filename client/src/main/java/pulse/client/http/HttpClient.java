package pulse.client.http;

import java.io.File;
import java.io.IOException;
import java.security.GeneralSecurityException;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.SSLContext;

import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.ssl.SSLContextBuilder;
import org.apache.http.ssl.SSLContexts;

public class HttpClient {

    public static SSLContext getSSLContext(String trustStoreFile, String trustStorePass) {
        try {
            SSLContextBuilder builder = SSLContexts.custom();
            if (null != trustStoreFile) {
                char[] password = null != trustStorePass ? trustStorePass.toCharArray() : null;
                builder.loadTrustMaterial(new File(trustStoreFile), password);
            }
            return builder.build();
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Unable to create SSL context from " + trustStoreFile, e);
        }
    }

    public static CloseableHttpClient get(int connectTimeout, int socketTimeout) {
        return get(SSLContexts.createDefault(), connectTimeout, socketTimeout, true);
    }

    public static CloseableHttpClient get(SSLContext ssl, int connectTimeout, int socketTimeout, boolean hostVerificationEnabled) {
        RequestConfig defaultRequestConfig = RequestConfig.custom().setCookieSpec(CookieSpecs.STANDARD).setConnectTimeout(connectTimeout)
                        .setConnectionRequestTimeout(connectTimeout).setSocketTimeout(socketTimeout).build();
        HostnameVerifier hostnameVerifier;
        if (hostVerificationEnabled) {
            hostnameVerifier = SSLConnectionSocketFactory.getDefaultHostnameVerifier();
        } else {
            hostnameVerifier = new NoopHostnameVerifier();
        }
        HttpClientBuilder builder = HttpClients.custom().setSSLContext(ssl).setDefaultRequestConfig(defaultRequestConfig)
                        .setSSLHostnameVerifier(hostnameVerifier).useSystemProperties();
        return builder.build();
    }

}
