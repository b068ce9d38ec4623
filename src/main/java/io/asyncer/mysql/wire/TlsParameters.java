/*
 * Copyright 2023 asyncer.io projects
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.asyncer.mysql.wire;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * The TLS parameters of a SSL connection: enabled protocols, cipher suites and the SNI server names. Empty
 * lists mean the defaults of the TLS provider, or the host name of the server for SNI.
 */
public final class TlsParameters {

    private static final TlsParameters DEFAULT = new TlsParameters(Collections.emptyList(),
        Collections.emptyList(), Collections.emptyList());

    private final List<String> protocols;

    private final List<String> cipherSuites;

    private final List<String> serverNames;

    private TlsParameters(List<String> protocols, List<String> cipherSuites, List<String> serverNames) {
        this.protocols = protocols;
        this.cipherSuites = cipherSuites;
        this.serverNames = serverNames;
    }

    public List<String> getProtocols() {
        return protocols;
    }

    public List<String> getCipherSuites() {
        return cipherSuites;
    }

    public List<String> getServerNames() {
        return serverNames;
    }

    /**
     * Creates a copy with enabled TLS protocols, e.g. {@code TLSv1.2}, {@code TLSv1.3}.
     *
     * @param protocols the protocols.
     * @return the new parameters.
     * @throws IllegalArgumentException if {@code protocols} is {@code null}.
     */
    public TlsParameters withProtocols(String... protocols) {
        return new TlsParameters(copyOf(protocols, "protocols"), cipherSuites, serverNames);
    }

    /**
     * Creates a copy with enabled cipher suites.
     *
     * @param cipherSuites the cipher suites.
     * @return the new parameters.
     * @throws IllegalArgumentException if {@code cipherSuites} is {@code null}.
     */
    public TlsParameters withCipherSuites(String... cipherSuites) {
        return new TlsParameters(protocols, copyOf(cipherSuites, "cipherSuites"), serverNames);
    }

    /**
     * Creates a copy with SNI server names.
     *
     * @param serverNames the host names.
     * @return the new parameters.
     * @throws IllegalArgumentException if {@code serverNames} is {@code null}.
     */
    public TlsParameters withServerNames(String... serverNames) {
        return new TlsParameters(protocols, cipherSuites, copyOf(serverNames, "serverNames"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TlsParameters)) {
            return false;
        }

        TlsParameters that = (TlsParameters) o;

        return protocols.equals(that.protocols) && cipherSuites.equals(that.cipherSuites) &&
            serverNames.equals(that.serverNames);
    }

    @Override
    public int hashCode() {
        int result = protocols.hashCode();
        result = 31 * result + cipherSuites.hashCode();
        return 31 * result + serverNames.hashCode();
    }

    @Override
    public String toString() {
        return "TlsParameters{protocols=" + protocols + ", cipherSuites=" + cipherSuites + ", serverNames=" +
            serverNames + '}';
    }

    public static TlsParameters defaults() {
        return DEFAULT;
    }

    private static List<String> copyOf(String[] values, String name) {
        requireNonNull(values, name + " must not be null");

        List<String> result = new ArrayList<>(values.length);

        for (String value : values) {
            result.add(requireNonNull(value, name + " must not contain null"));
        }

        return Collections.unmodifiableList(result);
    }
}
