package com.piiguard.infrastructure.masking;

import cn.hutool.core.util.DesensitizedUtil;
import com.piiguard.domain.model.MaskKind;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Display-only partial redaction of already-decrypted values.
 *
 * <p>Values that do not have the expected shape are returned unchanged; null or empty
 * input yields an empty string. Phone and ID card redaction is hutool's
 * {@link DesensitizedUtil}; bank card and generic formats are local. Masking is
 * irreversible and is never a substitute for a failed decryption.
 */
@Component
public class MaskingPolicy {

    private static final Pattern PHONE = Pattern.compile("^\\d{11}$");
    private static final Pattern ID_CARD = Pattern.compile("^\\d{17}[\\dXx]$");
    private static final Pattern BANK_CARD = Pattern.compile("^\\d{12,}$");
    private static final Pattern BANK_CARD_SEPARATORS = Pattern.compile("[\\s-]");

    private static final String BANK_CARD_PREFIX = "**** **** **** ";

    public String mask(String value, MaskKind kind) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (kind == null) {
            return value;
        }

        switch (kind) {
            case PHONE:
                return maskPhone(value);
            case ID_CARD:
                return maskIdCard(value);
            case BANK_CARD:
                return maskBankCard(value);
            case GENERIC:
                return maskGeneric(value);
            default:
                return value;
        }
    }

    /**
     * 13812345678 -> 138****5678
     */
    private String maskPhone(String phone) {
        if (!PHONE.matcher(phone).matches()) {
            return phone;
        }
        return DesensitizedUtil.mobilePhone(phone);
    }

    /**
     * 110101199001011234 -> 110***********1234, 11010119900101123X -> 110***********123X
     */
    private String maskIdCard(String idCard) {
        if (!ID_CARD.matcher(idCard).matches()) {
            return idCard;
        }
        return DesensitizedUtil.idCardNum(idCard, 3, 4);
    }

    /**
     * 6222 0212 3456 7890 -> **** **** **** 7890
     */
    private String maskBankCard(String bankCard) {
        String cleaned = BANK_CARD_SEPARATORS.matcher(bankCard).replaceAll("");
        if (!BANK_CARD.matcher(cleaned).matches()) {
            return bankCard;
        }
        return BANK_CARD_PREFIX + cleaned.substring(cleaned.length() - 4);
    }

    private String maskGeneric(String value) {
        if (value.length() > 7) {
            return value.substring(0, 3) + "****" + value.substring(value.length() - 4);
        }
        return "****";
    }
}
