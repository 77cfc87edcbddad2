package com.ryuqq.provisioner.application.identity;

/**
 * 로그용 주체 식별자 마스킹.
 *
 * <ul>
 *   <li>UPN 형태 ({@code alice@example.com}): 로컬 파트 앞 2자만 남김 → {@code al***@example.com}</li>
 *   <li>그 외: 앞 8자 + {@code ***}</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class PrincipalMasker {

    private static final String MASK = "***";

    private PrincipalMasker() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String mask(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return MASK;
        }
        int at = identifier.indexOf('@');
        if (at > 0) {
            String local = identifier.substring(0, at);
            String domain = identifier.substring(at + 1);
            return local.substring(0, Math.min(2, local.length())) + MASK + "@" + domain;
        }
        return identifier.substring(0, Math.min(8, identifier.length())) + MASK;
    }
}
