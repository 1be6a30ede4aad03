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

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

public class MachineIdUtils {

  /**
   * Reads the numeric index of a machine identity such as <code>machine_12</code>. Identities
   * that are missing or hold no non-negative number after the prefix map to machine 0.
   */
  public static int machineIndex(String machineId, String prefix) {
    if (StringUtils.isBlank(machineId)) {
      return 0;
    }
    final String digits = StringUtils.removeStart(machineId.trim(), prefix);
    final int index = NumberUtils.toInt(digits, 0);
    return Math.max(index, 0);
  }

  public static String machineId(int index, String prefix) {
    return prefix + index;
  }
}
