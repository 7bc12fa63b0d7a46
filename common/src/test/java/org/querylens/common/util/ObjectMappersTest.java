/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.querylens.common.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ObjectMappersTest {

    @Test
    public void shouldWriteOnePropertyPerLine() throws Exception {
        // given
        ObjectMapper mapper = ObjectMappers.create();
        ObjectNode rootNode = mapper.createObjectNode();
        rootNode.putObject("general").put("highSecurity", false);
        // when
        String json = ObjectMappers.prettyWriter(mapper).writeValueAsString(rootNode);
        // then
        assertThat(json.replace(System.lineSeparator(), "\n")).isEqualTo("{\n"
                + "  \"general\": {\n"
                + "    \"highSecurity\": false\n"
                + "  }\n"
                + "}");
    }
}
