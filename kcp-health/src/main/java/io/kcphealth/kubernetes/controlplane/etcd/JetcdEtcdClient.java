/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.etcd;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.etcd.jetcd.Client;
import io.etcd.jetcd.cluster.MemberListResponse;
import io.etcd.jetcd.maintenance.AlarmMember;
import io.etcd.jetcd.maintenance.AlarmResponse;
import io.etcd.jetcd.maintenance.AlarmType;

import io.kcphealth.kubernetes.controlplane.HealthCheckCancelledException;

/**
 * {@link EtcdClient} backed by jetcd. Owns the connection it talks over and closes it
 * together with the jetcd client.
 */
class JetcdEtcdClient implements EtcdClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JetcdEtcdClient.class);

    private final Client client;
    private final AutoCloseable connection;
    private final Duration requestTimeout;

    JetcdEtcdClient(Client client, AutoCloseable connection, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client);
        this.connection = Objects.requireNonNull(connection);
        this.requestTimeout = Objects.requireNonNull(requestTimeout);
    }

    @Override
    public List<EtcdMember> members() {
        MemberListResponse memberList = await(client.getClusterClient().listMember(), "listing etcd members");
        AlarmResponse alarmList = await(client.getMaintenanceClient().listAlarms(), "listing etcd alarms");
        long clusterId = memberList.getHeader().getClusterId();
        Map<Long, List<String>> alarmsByMember = alarmList.getAlarms().stream()
                .filter(alarm -> alarm.getAlarmType() != AlarmType.NONE)
                .collect(Collectors.groupingBy(AlarmMember::getMemberId,
                        Collectors.mapping(alarm -> alarm.getAlarmType().name(), Collectors.toList())));
        return memberList.getMembers().stream()
                .map(member -> new EtcdMember(member.getId(), member.getName(), clusterId,
                        alarmsByMember.getOrDefault(member.getId(), List.of())))
                .toList();
    }

    private <T> T await(CompletableFuture<T> future, String activity) {
        try {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new HealthCheckCancelledException("health check cancelled while " + activity, e);
        }
        catch (ExecutionException e) {
            throw new EtcdClientException("failed " + activity, e.getCause());
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw new EtcdClientException("timed out after " + requestTimeout + " " + activity, e);
        }
    }

    @Override
    public void close() {
        try {
            client.close();
        }
        finally {
            try {
                connection.close();
            }
            catch (Exception e) {
                LOGGER.warn("Ignoring failure to close etcd connection", e);
            }
        }
    }
}
