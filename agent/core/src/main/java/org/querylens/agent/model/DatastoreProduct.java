/*
 * Copyright 2026 the original author or authors.
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
package org.querylens.agent.model;

// well-known datastore product names, any other string is also accepted as a product
public class DatastoreProduct {

    public static final String CASSANDRA = "Cassandra";
    public static final String DERBY = "Derby";
    public static final String DYNAMODB = "DynamoDB";
    public static final String ELASTICSEARCH = "Elasticsearch";
    public static final String FIREBIRD = "Firebird";
    public static final String H2 = "H2";
    public static final String HSQLDB = "HSQLDB";
    public static final String MEMCACHED = "Memcached";
    public static final String MONGODB = "MongoDB";
    public static final String MSSQL = "MSSQL";
    public static final String MYSQL = "MySQL";
    public static final String NEO4J = "Neo4j";
    public static final String ORACLE = "Oracle";
    public static final String POSTGRES = "Postgres";
    public static final String REDIS = "Redis";
    public static final String SNOWFLAKE = "Snowflake";
    public static final String SQLITE = "SQLite";

    private DatastoreProduct() {}
}
