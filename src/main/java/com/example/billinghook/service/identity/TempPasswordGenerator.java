package com.example.billinghook.service.identity;

import com.example.billinghook.config.ProvisioningProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 临时密码：大小写字母加数字，每类至少一个，打乱顺序。
 */
@Component
@RequiredArgsConstructor
public class TempPasswordGenerator {

    static final String UPPER = "ABCDEFGHJKLMNPQRSTUVWXYZ";
    static final String LOWER = "abcdefghijkmnopqrstuvwxyz";
    static final String DIGITS = "23456789";
    private static final String ALL = UPPER + LOWER + DIGITS;

    private static final int MIN_LENGTH = 8;

    private final SecureRandom random = new SecureRandom();
    private final ProvisioningProperties provisioningProperties;

    public String generate() {
        int length = Math.max(MIN_LENGTH, provisioningProperties.getTempPasswordLength());
        List<Character> chars = new ArrayList<>(length);
        chars.add(pick(UPPER));
        chars.add(pick(LOWER));
        chars.add(pick(DIGITS));
        while (chars.size() < length) {
            chars.add(pick(ALL));
        }
        Collections.shuffle(chars, random);

        StringBuilder sb = new StringBuilder(length);
        chars.forEach(sb::append);
        return sb.toString();
    }

    private char pick(String alphabet) {
        return alphabet.charAt(random.nextInt(alphabet.length()));
    }
}
