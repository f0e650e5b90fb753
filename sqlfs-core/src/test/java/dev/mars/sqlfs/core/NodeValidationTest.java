/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.sqlfs.core;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Bean validation constraints declared on {@link Node}, checked by a real validator.
 */
class NodeValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void createValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void testBuiltNodesAreValid() {
        Node root = Node.builder().id(1).name("").directory(true).owner("public").build();
        Node file = Node.builder()
                .id(2)
                .name("a.txt")
                .parentId(1L)
                .owner("alice")
                .contentRef("c0ffee")
                .size(3)
                .build();

        assertTrue(validator.validate(root).isEmpty());
        assertTrue(validator.validate(file).isEmpty());
    }

    @Test
    void testBlankOwnerIsReported() {
        Node node = Node.builder().id(3).name("docs").parentId(1L).directory(true).owner("  ").build();

        Set<ConstraintViolation<Node>> violations = validator.validate(node);

        assertEquals(1, violations.size());
        assertThat(violations)
                .extracting(violation -> violation.getPropertyPath().toString())
                .containsExactly("owner");
    }
}
