/// Immutable trip, vendor and location records, and the dataset that holds them.
///
/// ## Key Components
///
/// - {@link io.mobilitytools.analytics.model.TripRecord}: one taxi trip with derived rates
/// - {@link io.mobilitytools.analytics.model.TripDataset}: validated, read-only collection of records
package io.mobilitytools.analytics.model;

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
