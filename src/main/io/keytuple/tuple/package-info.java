/*
 * package-info.java
 *
 * This source file is part of the keytuple project, derived from the
 * FoundationDB open source project
 *
 * Copyright 2013-2018 Apple Inc. and the FoundationDB project authors
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


/**
 * Order-preserving encoding of typed tuples into byte strings. A packed
 *  {@link io.keytuple.tuple.Tuple} compares, as unsigned bytes, exactly as its elements
 *  compare semantically, so packed tuples can be used directly as keys of an ordered
 *  key-value store. {@link io.keytuple.tuple.Versionstamp}s that are not yet complete
 *  are written with a placeholder and an offset trailer by
 *  {@link io.keytuple.tuple.Tuple#packWithVersionstamp()}.
 */
package io.keytuple.tuple;
