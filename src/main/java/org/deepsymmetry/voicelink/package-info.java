/**
 * <p>Finds voice recognition devices on the local network.</p>
 *
 * <p>Devices do not announce themselves, so the {@link org.deepsymmetry.voicelink.DeviceFinder} looks for them by
 * probing every address on the subnets attached to this machine, as worked out by the
 * {@link org.deepsymmetry.voicelink.AddressSpaceEnumerator}, along with a few host names devices commonly answer
 * to. A host which accepts a connection on the service port becomes a {@link org.deepsymmetry.voicelink.Device},
 * described by whatever {@link org.deepsymmetry.voicelink.DeviceCapabilities} it is willing to report.</p>
 *
 * <p>Once a device has been chosen, the {@link org.deepsymmetry.voicelink.stream} package maintains a streaming
 * connection to it.</p>
 */
package org.deepsymmetry.voicelink;
