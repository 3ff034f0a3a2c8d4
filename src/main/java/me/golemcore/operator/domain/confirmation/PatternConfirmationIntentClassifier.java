package me.golemcore.operator.domain.confirmation;

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

import java.util.regex.Pattern;

/**
 * Recognizes one-word or short-phrase replies ("yes", "go ahead", "nope",
 * "scratch that") with optional trailing punctuation. Longer messages are
 * {@link ConfirmationIntent#NEITHER} so they go through the tool loop.
 */
@Component
public class PatternConfirmationIntentClassifier implements ConfirmationIntentClassifier {

    private static final Pattern CONFIRM_PATTERN = Pattern.compile(
            "^\\s*(confirm|yes|yep|yup|yeah|yea|sure|ok|okay|do it|go ahead|proceed|execute|approved?"
                    + "|absolutely|definitely|kk)\\s*[.!]?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CANCEL_PATTERN = Pattern.compile(
            "^\\s*(no|nah|nope|cancel|nevermind|never mind|abort|stop|don't|dont|scratch that)\\s*[.!]?\\s*$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public ConfirmationIntent classify(String text) {
        if (text == null || text.isBlank()) {
            return ConfirmationIntent.NEITHER;
        }
        if (CONFIRM_PATTERN.matcher(text).matches()) {
            return ConfirmationIntent.CONFIRM;
        }
        if (CANCEL_PATTERN.matcher(text).matches()) {
            return ConfirmationIntent.CANCEL;
        }
        return ConfirmationIntent.NEITHER;
    }
}
