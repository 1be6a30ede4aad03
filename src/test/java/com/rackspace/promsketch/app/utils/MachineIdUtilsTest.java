/*
 * Copyright 2022 Rackspace US, Inc.
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


package com.rackspace.promsketch.app.utils;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MachineIdUtilsTest {

  @Test
  void machineIndex() {
    assertThat(MachineIdUtils.machineIndex("machine_0", "machine_")).isEqualTo(0);
    assertThat(MachineIdUtils.machineIndex("machine_417", "machine_")).isEqualTo(417);
    assertThat(MachineIdUtils.machineIndex("42", "machine_")).isEqualTo(42);
  }

  @Test
  void unparsableMapsToZero() {
    assertThat(MachineIdUtils.machineIndex(null, "machine_")).isEqualTo(0);
    assertThat(MachineIdUtils.machineIndex("", "machine_")).isEqualTo(0);
    assertThat(MachineIdUtils.machineIndex("machine_x", "machine_")).isEqualTo(0);
    assertThat(MachineIdUtils.machineIndex("machine_-5", "machine_")).isEqualTo(0);
  }

  @Test
  void machineId() {
    assertThat(MachineIdUtils.machineId(12, "machine_")).isEqualTo("machine_12");
  }
}
