package com.telesync.upstream;

import com.telesync.shared.model.UpstreamItem;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** Decides which upstream items are media worth downloading. */
public class MediaFilter {

    private static final List<Pattern> VIDEO_URLS = List.of(
            Pattern.compile("(?:https?://)?(?:www\\.)?youtube\\.com/watch\\?v=[a-zA-Z0-9_-]+"),
            Pattern.compile("(?:https?://)?(?:www\\.)?youtu\\.be/[a-zA-Z0-9_-]+"),
            Pattern.compile("(?:https?://)?(?:www\\.)?youtube\\.com/(?:embed|v)/[a-zA-Z0-9_-]+"),
            Pattern.compile("(?:https?://)?(?:www\\.)?vimeo\\.com/\\d+"),
            Pattern.compile("(?:https?://)?(?:www\\.)?dailymotion\\.com/video/[a-zA-Z0-9_-]+"),
            Pattern.compile("(?:https?://)?(?:www\\.)?twitch\\.tv/videos/\\d+"),
            Pattern.compile("(?:https?://)?(?:www\\.)?tiktok\\.com/@[^/\\s]+/video/\\d+")
    );

    public boolean isMedia(UpstreamItem item) {
        return isVideoType(item.contentType()) || videoUrl(item.text()).isPresent();
    }

    public static boolean isVideoType(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("video/");
    }

    public static Optional<String> videoUrl(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        for (var p : VIDEO_URLS) {
            var m = p.matcher(text);
            if (m.find()) return Optional.of(m.group());
        }
        return Optional.empty();
    }
}
