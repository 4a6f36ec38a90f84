package com.webfront.core.utils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLServerSocketFactory;

import com.webfront.config.ListenerConfig;
import com.webfront.config.WebfrontProperties;

/**
 * Builds TLS server socket factories from listener keystores.
 */
public class SslUtils {

    private SslUtils() {
        // Utility class
    }

    /**
     * Creates an {@link SSLServerSocketFactory} from a PKCS12 keystore.
     * Relative keystore paths are resolved against
     * {@link WebfrontProperties#getCertificatesPath()}.
     * 
     * @param config      The listener configuration.
     * @param globalProps Global properties (for certificatesPath).
     * @return An initialized SSL server socket factory.
     * @throws IOException              If the keystore file cannot be read.
     * @throws GeneralSecurityException If the SSL context or keystore cannot be
     *                                  initialized.
     */
    public static SSLServerSocketFactory createSslFactory(ListenerConfig config, WebfrontProperties globalProps)
            throws IOException, GeneralSecurityException {
        String ksPathStr = config.getKeystorePath();
        if (ksPathStr == null || ksPathStr.isEmpty()) {
            throw new IllegalArgumentException(
                    "Keystore path must be specified when TLS is enabled for " + config.getName());
        }

        Path ksPath = Paths.get(ksPathStr);
        if (!ksPath.isAbsolute() && globalProps.getCertificatesPath() != null) {
            ksPath = Paths.get(globalProps.getCertificatesPath(), ksPathStr);
        }

        char[] password = config.getKeystorePassword() != null ? config.getKeystorePassword().toCharArray()
                : new char[0];

        KeyStore ks = KeyStore.getInstance("PKCS12");
        try (InputStream is = new FileInputStream(ksPath.toFile())) {
            ks.load(is, password);
        }

        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(ks, password);

        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(kmf.getKeyManagers(), null, null);

        return sslContext.getServerSocketFactory();
    }
}
