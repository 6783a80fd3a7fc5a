package com.streamfirst.feedrelay.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Per-mapping rendering options handed to the renderer.
 */
@Value
@Builder(toBuilder = true)
public class FormattingProfile {

    public static final FormattingProfile DEFAULT = FormattingProfile.builder().build();

    public enum AttachmentsStyle {
        /** One summary line per attachment */
        SUMMARY,
        /** Bare links */
        LINKS
    }

    @Builder.Default boolean disablePreview = true;
    @Builder.Default int maxLength = 3500;
    @Builder.Default String ellipsis = "…";
    @Builder.Default AttachmentsStyle attachmentsStyle = AttachmentsStyle.SUMMARY;
    @Builder.Default boolean showSourceLink = false;
}
