package com.baselinesentinel.core.normalize;

import com.baselinesentinel.core.model.BucketingMode;
import com.baselinesentinel.core.model.Category;

/**
 * Maps a status or response code onto its {@link Category} by the code's
 * first character.
 *
 * @since 1.0.0
 */
public final class CategoryClassifier {

    private CategoryClassifier() {
    }

    /**
     * Classify with {@link BucketingMode#STATUS_CODE} semantics.
     *
     * @param code raw code label, may be {@code null}
     * @return category, {@link Category#UNKNOWN} if unrecognised
     */
    public static Category classify(String code) {
        return classify(code, BucketingMode.STATUS_CODE);
    }

    /**
     * @param code raw code label, may be {@code null}
     * @param mode bucketing mode; {@code 0DC} is only produced in
     *             {@link BucketingMode#RESPONSE_CODE}
     * @return category, {@link Category#UNKNOWN} if unrecognised
     */
    public static Category classify(String code, BucketingMode mode) {
        if (code == null || code.isBlank()) {
            return Category.UNKNOWN;
        }
        return switch (code.trim().charAt(0)) {
            case '2' -> Category.SUCCESS;
            case '3' -> Category.REDIRECT;
            case '4' -> Category.CLIENT_ERROR;
            case '5' -> Category.SERVER_ERROR;
            case '0' -> mode == BucketingMode.RESPONSE_CODE ? Category.NO_DOWNSTREAM : Category.UNKNOWN;
            default -> Category.UNKNOWN;
        };
    }
}
