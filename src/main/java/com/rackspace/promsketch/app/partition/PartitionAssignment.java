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


package com.rackspace.promsketch.app.partition;

import lombok.Data;

/**
 * One partition of the machine space: machines <code>[firstMachine, lastMachine]</code> served by
 * the listener at <code>host:port</code>.
 */
@Data
public class PartitionAssignment {
  final int index;
  final int firstMachine;
  final int lastMachine;
  final String host;
  final int port;

  public boolean owns(int machineIndex) {
    return machineIndex >= firstMachine && machineIndex <= lastMachine;
  }

  public String getAddress() {
    return host + ":" + port;
  }
}
