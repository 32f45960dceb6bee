package com.example.transfersim.alias;

import com.example.transfersim.entity.AliasType;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 別名正規化與類型推斷
 *
 * 正規化規則：
 * - EMAIL: 去除前後空白並轉小寫
 * - PHONE: 只保留數字；11 碼且 1 開頭 → +digits；10 碼 → +1digits；其他 → +digits
 * - USERNAME: 去除前後空白並轉小寫，補上 @ 前綴
 * - RANDOM_KEY: 轉大寫
 *
 * 所有規則對已正規化的值再做一次結果不變
 */
public final class AliasNormalizer {

    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern PHONE_DIGITS = Pattern.compile("^\\d{10,15}$");
    private static final Pattern RANDOM_KEY = Pattern.compile("^[A-Z0-9]{8}$", Pattern.CASE_INSENSITIVE);

    private AliasNormalizer() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 依格式推斷別名類型
     *
     * 判斷順序：EMAIL → USERNAME → PHONE → RANDOM_KEY
     *
     * @param value 原始別名
     * @return 推斷出的類型，無法判斷時為 empty
     */
    public static Optional<AliasType> inferType(String value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.contains("@") && value.contains(".")) {
            return Optional.of(AliasType.EMAIL);
        }
        if (value.startsWith("@")) {
            return Optional.of(AliasType.USERNAME);
        }
        if (PHONE_DIGITS.matcher(NON_DIGIT.matcher(value).replaceAll("")).matches()) {
            return Optional.of(AliasType.PHONE);
        }
        if (RANDOM_KEY.matcher(value).matches()) {
            return Optional.of(AliasType.RANDOM_KEY);
        }
        return Optional.empty();
    }

    public static String normalize(AliasType type, String value) {
        switch (type) {
            case EMAIL:
                return value.trim().toLowerCase(Locale.ROOT);
            case PHONE:
                return normalizePhone(value);
            case USERNAME:
                String username = value.trim().toLowerCase(Locale.ROOT);
                return username.startsWith("@") ? username : "@" + username;
            case RANDOM_KEY:
                return value.toUpperCase(Locale.ROOT);
            default:
                return value;
        }
    }

    private static String normalizePhone(String value) {
        String digits = NON_DIGIT.matcher(value).replaceAll("");
        if (digits.length() == 11 && digits.startsWith("1")) {
            return "+" + digits;
        }
        if (digits.length() == 10) {
            return "+1" + digits;
        }
        return "+" + digits;
    }
}
