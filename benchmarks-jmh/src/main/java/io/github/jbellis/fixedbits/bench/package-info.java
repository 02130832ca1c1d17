/*
 * Copyright DataStax, Inc.
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


/**
 * JMH benchmarks for the fixed-width bitset types.
 * <p>
 * {@link io.github.jbellis.fixedbits.bench.BitsetOperationsBenchmark} measures single-bit access,
 * word-wise logic, conversion and rendering for every width.
 *
 * <h2>Running Benchmarks</h2>
 *
 * <pre>
 * mvn clean package -pl benchmarks-jmh -am
 * java -cp "benchmarks-jmh/target/classes:$(cat cp.txt)" org.openjdk.jmh.Main BitsetOperationsBenchmark
 * </pre>
 * where {@code cp.txt} is the module classpath written by
 * {@code mvn -pl benchmarks-jmh dependency:build-classpath -Dmdep.outputFile=cp.txt}.
 */
package io.github.jbellis.fixedbits.bench;
