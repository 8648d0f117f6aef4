package me.golemcore.gateway.domain.service;

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

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces card-like numbers, email addresses and phone-like numbers with
 * sequential placeholder tokens ({@code CARD_TOKEN_1}, {@code EMAIL_TOKEN_1},
 * {@code PHONE_TOKEN_1}, ...). Numbering restarts at 1 for every call and every
 * kind.
 *
 * <p>
 * Kinds are applied in a fixed order: cards, then emails, then phones. Card and
 * phone patterns overlap on plain digit runs, so cards must be consumed first.
 * An address with chained {@code @} segments is consumed as one match, so no
 * {@code @domain} remainder is left next to a token. Together with token text
 * never matching any pattern, this makes masking idempotent.
 *
 * <p>
 * <b>Residual risk:</b> this is a pattern heuristic. It will miss PII that does
 * not look like these three shapes (names, addresses, national ids, numbers
 * written with unusual separators) and may mask harmless digit runs. It is a
 * placeholder policy, not a data-loss-prevention guarantee.
 *
 * <p>
 * Stateless and thread-safe.
 */
@Component
public class SensitiveDataMasker {

    private static final List<MaskRule> RULES = List.of(
            new MaskRule("CARD_TOKEN", Pattern.compile("\\b(?:\\d[ -]*?){13,16}\\b")),
            new MaskRule("EMAIL_TOKEN", Pattern.compile("[\\w.\\-]+(?:@[\\w.\\-]+)+\\.\\w+")),
            new MaskRule("PHONE_TOKEN", Pattern.compile("\\b\\+?\\d{1,3}[- ]?\\d{3,5}[- ]?\\d{4,10}\\b")));

    /**
     * Mask sensitive substrings. Null and empty input are returned unchanged.
     */
    public String mask(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        String text = input;
        for (MaskRule rule : RULES) {
            text = rule.apply(text);
        }
        return text;
    }

    private record MaskRule(String tokenPrefix, Pattern pattern) {

        String apply(String text) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                return text;
            }
            StringBuilder out = new StringBuilder(text.length());
            int index = 1;
            do {
                matcher.appendReplacement(out, tokenPrefix + "_" + index);
                index++;
            } while (matcher.find());
            matcher.appendTail(out);
            return out.toString();
        }
    }
}
