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

package com.rackspace.promsketch.app.config.configValidator;

import com.rackspace.promsketch.app.config.AppProperties;
import javax.validation.ConstraintValidator;
import javax.validation.ConstraintValidatorContext;

/**
 * Rejects, at start-up, any layout in which some partition that could ever be provisioned
 * would land on a reserved port.
 */
public class ConcretePartitionLayoutValidator implements
    ConstraintValidator<PartitionLayoutValidator, AppProperties> {

  private static final int MAX_PORT = 65535;

  @Override
  public boolean isValid(AppProperties properties, ConstraintValidatorContext context) {
    if (properties == null) {
      return true;
    }

    final long lastPort = (long) properties.getBasePort() + properties.getMaxPartitions() - 1;
    if (lastPort > MAX_PORT) {
      return false;
    }

    for (int port = properties.getBasePort(); port <= lastPort; port++) {
      if (properties.isReserved(port)) {
        return false;
      }
    }
    return true;
  }
}
