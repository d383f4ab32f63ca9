package me.golemcore.kernel.domain.model;

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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Content variant of a normalized channel message. Only the fields relevant to
 * {@link #getKind()} are populated.
 */
@Value
@Builder
public class ChannelContent {

    Kind kind;

    /** TEXT body, or caption for IMAGE/FILE/VOICE. */
    String text;

    String url;
    String mimeType;
    String fileName;
    Long sizeBytes;
    Double latitude;
    Double longitude;
    String command;

    @Singular
    List<String> args;

    public enum Kind {
        TEXT, IMAGE, FILE, VOICE, LOCATION, COMMAND
    }

    public static ChannelContent text(String text) {
        return ChannelContent.builder().kind(Kind.TEXT).text(text).build();
    }

    public static ChannelContent command(String command, List<String> args) {
        return ChannelContent.builder().kind(Kind.COMMAND).command(command)
                .args(args != null ? args : List.of()).build();
    }

    public static ChannelContent location(double latitude, double longitude) {
        return ChannelContent.builder().kind(Kind.LOCATION).latitude(latitude).longitude(longitude).build();
    }

    /**
     * Text that content-matching triggers see: the body for TEXT, the caption
     * for media, {@code /command args} for COMMAND, null for LOCATION.
     */
    public String textOrNull() {
        if (kind == null) {
            return text;
        }
        return switch (kind) {
        case TEXT, IMAGE, FILE, VOICE -> text;
        case COMMAND -> command == null ? null
                : args.isEmpty() ? "/" + command : "/" + command + " " + String.join(" ", args);
        case LOCATION -> null;
        };
    }
}
