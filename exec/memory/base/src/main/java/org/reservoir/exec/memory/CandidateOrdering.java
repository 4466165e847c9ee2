/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.reservoir.exec.memory;

import java.util.Comparator;

/**
 * Decides which pools an arbitrator takes capacity from first. Ties are broken
 * by pool name so that a round is deterministic for a given snapshot.
 */
public interface CandidateOrdering {

  /**
   * Order for taking unused capacity.
   */
  Comparator<ArbitrationCandidate> freeCapacityOrder();

  /**
   * Order for invoking reclaimers on used memory.
   */
  Comparator<ArbitrationCandidate> reclaimOrder();

  Comparator<ArbitrationCandidate> BY_NAME =
      Comparator.comparing(candidate -> candidate.getPool().getName());

  /**
   * Pools with the most unused capacity give first, then pools with the most
   * reclaimable memory.
   */
  CandidateOrdering FREE_CAPACITY_FIRST = new CandidateOrdering() {
    @Override
    public Comparator<ArbitrationCandidate> freeCapacityOrder() {
      return Comparator.comparingLong(ArbitrationCandidate::getFreeCapacity).reversed().thenComparing(BY_NAME);
    }

    @Override
    public Comparator<ArbitrationCandidate> reclaimOrder() {
      return Comparator.comparingLong(ArbitrationCandidate::getReclaimableBytes).reversed().thenComparing(BY_NAME);
    }

    @Override
    public String toString() {
      return "FREE_CAPACITY_FIRST";
    }
  };

  /**
   * The pools holding the largest grants give first in both phases.
   */
  CandidateOrdering LARGEST_CAPACITY_FIRST = new CandidateOrdering() {
    @Override
    public Comparator<ArbitrationCandidate> freeCapacityOrder() {
      return Comparator.comparingLong(ArbitrationCandidate::getCapacity).reversed().thenComparing(BY_NAME);
    }

    @Override
    public Comparator<ArbitrationCandidate> reclaimOrder() {
      return freeCapacityOrder();
    }

    @Override
    public String toString() {
      return "LARGEST_CAPACITY_FIRST";
    }
  };
}
