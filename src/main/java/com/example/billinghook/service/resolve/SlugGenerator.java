package com.example.billinghook.service.resolve;

import com.example.billinghook.repository.CompanyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.text.Normalizer;
import java.util.Locale;

/**
 * 公司 slug 生成：规范化名称，冲突时追加数字后缀，25 次后改用随机后缀。
 */
@Component
@RequiredArgsConstructor
public class SlugGenerator {

    static final String DEFAULT_SLUG = "empresa";
    static final int MAX_NUMERIC_ATTEMPTS = 25;

    private static final String RANDOM_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final CompanyRepository companyRepository;

    public String uniqueSlug(String name) {
        String base = slugify(name);
        if (!companyRepository.existsBySlug(base)) {
            return base;
        }
        for (int suffix = 1; suffix <= MAX_NUMERIC_ATTEMPTS; suffix++) {
            String candidate = base + "-" + suffix;
            if (!companyRepository.existsBySlug(candidate)) {
                return candidate;
            }
        }
        return base + "-" + randomSuffix(8);
    }

    static String slugify(String value) {
        if (value == null) {
            return DEFAULT_SLUG;
        }
        String ascii = Normalizer.normalize(value, Normalizer.Form.NFD).replaceAll("\\p{M}+", "");
        String slug = ascii.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? DEFAULT_SLUG : slug;
    }

    private static String randomSuffix(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(RANDOM_ALPHABET.charAt(RANDOM.nextInt(RANDOM_ALPHABET.length())));
        }
        return sb.toString();
    }
}
