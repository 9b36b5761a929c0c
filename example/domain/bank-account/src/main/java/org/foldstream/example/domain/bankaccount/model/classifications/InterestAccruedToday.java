/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.foldstream.example.domain.bankaccount.model.classifications;

import org.foldstream.projection.classification.ClassificationDefinition;

import java.time.ZoneOffset;

import static org.foldstream.projection.classification.ClassificationResult.EXCLUDE;
import static org.foldstream.projection.classification.ClassificationResult.INCLUDE;

/**
 * Includes an account if interest has been accrued with an effective date on the same (UTC) day as the date the
 * classification is evaluated for.
 */
public class InterestAccruedToday {
    public static final String NAME = "InterestAccruedToday";

    private InterestAccruedToday() {
    }

    public static ClassificationDefinition definition() {
        return ClassificationDefinition.builder(NAME)
                .on("InterestAccrued", (current, envelope, evaluationDate) -> {
                    boolean today = envelope.effectiveOrLoggedDate().atZoneSameInstant(ZoneOffset.UTC).toLocalDate()
                            .equals(evaluationDate.atZoneSameInstant(ZoneOffset.UTC).toLocalDate());
                    return today ? INCLUDE : EXCLUDE;
                })
                .build();
    }
}
