/// Priority queue and top-k selection.
///
/// The heap is a plain binary min-heap over an array list; [io.mobilitytools.algorithms.heap.TopK]
/// keeps a bounded heap of the k best candidates seen so far.
///
/// ## Key Components
///
/// - {@link io.mobilitytools.algorithms.heap.MinHeap}: array-backed binary min-heap
/// - {@link io.mobilitytools.algorithms.heap.TopK}: k largest scored items, descending
/// - {@link io.mobilitytools.algorithms.heap.Scored}: a value paired with its payload
package io.mobilitytools.algorithms.heap;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
