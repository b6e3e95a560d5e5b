/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.ledger.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.elasticsoftware.ledger.annotations.CommandInfo;
import org.elasticsoftware.ledger.commands.Command;

public record CommandType<C extends Command>(
        String typeName,
        int version,
        @JsonIgnore Class<C> typeClass
) {
    public static <C extends Command> CommandType<C> of(Class<C> commandClass) {
        CommandInfo info = commandClass.getAnnotation(CommandInfo.class);
        if (info == null) {
            throw new IllegalArgumentException("Command class " + commandClass.getName() + " must be annotated with @CommandInfo");
        }
        return new CommandType<>(info.type(), info.version(), commandClass);
    }
}
