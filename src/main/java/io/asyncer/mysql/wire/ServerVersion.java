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

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * The version of the server, parsed from the version string of the initial handshake.
 * <p>
 * MariaDB 10.x servers prefix their version with {@code 5.5.5-} to keep old replication clients working,
 * the prefix is skipped.
 */
public final class ServerVersion implements Comparable<ServerVersion> {

    private static final String MARIADB_RPL_HACK_PREFIX = "5.5.5-";

    private static final String MARIADB = "MariaDB";

    private final String origin;

    private final int major;

    private final int minor;

    private final int patch;

    private final boolean isMariaDb;

    private ServerVersion(String origin, int major, int minor, int patch, boolean isMariaDb) {
        this.origin = origin;
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.isMariaDb = isMariaDb;
    }

    public boolean isGreaterThanOrEqualTo(int major, int minor, int patch) {
        return compareTo(create(major, minor, patch)) >= 0;
    }

    public boolean isLessThan(int major, int minor, int patch) {
        return compareTo(create(major, minor, patch)) < 0;
    }

    @Override
    public int compareTo(ServerVersion version) {
        // Standard `Comparable` must throw `NullPointerException` in `compareTo`.
        if (this.major != version.major) {
            return Integer.compare(this.major, version.major);
        } else if (this.minor != version.minor) {
            return Integer.compare(this.minor, version.minor);
        }

        return Integer.compare(this.patch, version.patch);
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public boolean isMariaDb() {
        return isMariaDb;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServerVersion)) {
            return false;
        }

        ServerVersion that = (ServerVersion) o;

        return major == that.major && minor == that.minor && patch == that.patch && isMariaDb == that.isMariaDb;
    }

    @Override
    public int hashCode() {
        int hash = 31 * major + minor;
        hash = 31 * hash + patch;
        return 31 * hash + (isMariaDb ? 1 : 0);
    }

    @Override
    public String toString() {
        if (origin.isEmpty()) {
            return major + "." + minor + '.' + patch;
        }

        return origin;
    }

    /**
     * Parses a version string, e.g. {@code 8.0.36}, {@code 5.7.44-log} or {@code 5.5.5-10.11.6-MariaDB}.
     * Missing or non-numeric parts are {@code 0}.
     *
     * @param version the version string.
     * @return the parsed version.
     * @throws IllegalArgumentException if {@code version} is {@code null}.
     */
    public static ServerVersion parse(String version) {
        requireNonNull(version, "version must not be null");

        boolean isMariaDb = version.contains(MARIADB);
        int start = 0;

        if (version.startsWith(MARIADB_RPL_HACK_PREFIX) && isMariaDb) {
            start = MARIADB_RPL_HACK_PREFIX.length();
        }

        int[] parts = new int[3];
        int part = 0;
        int length = version.length();

        for (int i = start; i < length && part < parts.length; ++i) {
            char ch = version.charAt(i);

            if (ch >= '0' && ch <= '9') {
                parts[part] = parts[part] * 10 + (ch - '0');
            } else if (ch == '.') {
                ++part;
            } else {
                break;
            }
        }

        return new ServerVersion(version, parts[0], parts[1], parts[2], isMariaDb);
    }

    public static ServerVersion create(int major, int minor, int patch) {
        return new ServerVersion("", major, minor, patch, false);
    }
}
