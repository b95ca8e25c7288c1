package io.github.goodees.escqrs.store;

/*-
 * #%L
 * escqrs
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Header data of a snapshot.
 */
public final class SnapshotMetadata {
    public static final String NO_COMPRESSION = "none";

    private final String checksum;
    private final long size;
    private final String compression;
    private final String serializationFormat;

    public SnapshotMetadata(String checksum, long size, String compression, String serializationFormat) {
        this.checksum = checksum;
        this.size = size;
        this.compression = compression;
        this.serializationFormat = serializationFormat;
    }

    /**
     * Describe serialized state.
     * @param serializedState state in its serialized form
     * @param serializationFormat name of format
     * @return metadata with checksum and size of the state
     */
    public static SnapshotMetadata describe(String serializedState, String serializationFormat) {
        byte[] bytes = serializedState.getBytes(StandardCharsets.UTF_8);
        return new SnapshotMetadata(checksum(bytes), bytes.length, NO_COMPRESSION, serializationFormat);
    }

    /**
     * SHA-256 digest of the data in hex.
     * @param data data to digest
     * @return lower case hex string
     */
    public static String checksum(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(data);
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to support SHA-256
            throw new IllegalStateException(e);
        }
    }

    public String getChecksum() {
        return checksum;
    }

    /**
     * Size of serialized state.
     * @return size in bytes
     */
    public long getSize() {
        return size;
    }

    public String getCompression() {
        return compression;
    }

    public String getSerializationFormat() {
        return serializationFormat;
    }

    @Override
    public String toString() {
        return "SnapshotMetadata{checksum=" + checksum + ", size=" + size + ", compression=" + compression
                + ", format=" + serializationFormat + '}';
    }
}
