package me.golemcore.chorus.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Raw attachment delivered by a channel together with an inbound message.
 *
 * <p>
 * Channels may hand over a {@link Loader} instead of the bytes, so that the
 * download happens on a persona worker after the message was admitted, not
 * on the channel's receiving thread.
 */
@Data
@Builder
public class Attachment {

    public enum Type {
        VOICE, AUDIO, VIDEO, IMAGE, DOCUMENT
    }

    /**
     * Fetches the attachment bytes, returning {@code null} when they are not
     * available.
     */
    @FunctionalInterface
    public interface Loader {
        byte[] load();
    }

    private Type type;
    private byte[] data;
    private String filename;
    private String mimeType;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Loader loader;

    public boolean hasData() {
        return data != null && data.length > 0;
    }

    /**
     * Runs the loader once if the bytes have not been fetched yet.
     *
     * @return whether data is available afterwards
     */
    public synchronized boolean loadData() {
        if (data == null && loader != null) {
            Loader pending = loader;
            loader = null;
            data = pending.load();
        }
        return hasData();
    }
}
