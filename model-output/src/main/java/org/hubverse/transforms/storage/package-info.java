/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
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
 * Storage abstraction for model-output files.
 *
 * <p>Paths are addressed as {@code container/path}, where the container is an
 * S3 bucket or a directory under a local root.</p>
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link org.hubverse.transforms.storage.StorageProvider} - Streaming, random-access and write operations</li>
 *   <li>{@link org.hubverse.transforms.storage.S3StorageProvider} - Amazon S3 implementation</li>
 *   <li>{@link org.hubverse.transforms.storage.LocalFileStorageProvider} - Local directory implementation</li>
 *   <li>{@link org.hubverse.transforms.storage.StorageProviderInputFile} - Parquet input over any provider</li>
 * </ul>
 */
package org.hubverse.transforms.storage;
