/*
 * package-info.java
 *
 * This source file is part of the vpnclient-async open source project
 *
 * Copyright 2020-2026 the vpnclient-async project authors
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
 * Runtime plumbing shared by the asynchronous layers of the VPN client. Start an
 *  {@link net.vpnclient.AsyncRuntime} once per process and hand its worker pool,
 *  {@link net.vpnclient.async.ScheduledTimer timer},
 *  {@link net.vpnclient.operations.OperationQueue operation queue} and
 *  {@link net.vpnclient.operations.ExclusivityController exclusivity controller} to the
 *  components that need them. Settings come from {@link net.vpnclient.RuntimeOptions}.
 */
package net.vpnclient;
